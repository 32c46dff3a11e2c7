package com.tony.fantasyAnalytics.model.dto;

import com.tony.fantasyAnalytics.model.PredictionRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictionQueryResponse {
    private int season;
    private List<PredictionRecord> predictions;
    private PredictionSummary summary;
    private String note;
}

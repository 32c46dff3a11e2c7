package com.tony.fantasyAnalytics.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ScrapeRequest {
    // Vide : les N dernières saisons (fantasy.pipeline.scraper.years-back)
    private List<@Min(1970) @Max(2100) Integer> years = new ArrayList<>();
}

package com.tony.fantasyAnalytics.controller;

import com.tony.fantasyAnalytics.model.dto.PredictionQueryResponse;
import com.tony.fantasyAnalytics.service.PredictionQueryService;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/predictions")
@RequiredArgsConstructor
@Validated
public class PredictionController {

    private final PredictionQueryService queryService;

    // ex : GET /api/v1/predictions?top_n=20&position=wr
    @GetMapping
    public ResponseEntity<PredictionQueryResponse> getPredictions(
            @RequestParam(name = "top_n", required = false) @Min(1) Integer topN,
            @RequestParam(required = false) String position) {
        return ResponseEntity.ok(queryService.query(topN, position));
    }
}

package com.tony.fantasyAnalytics.controller;

import com.tony.fantasyAnalytics.model.dto.AnalysisReport;
import com.tony.fantasyAnalytics.service.AnalysisReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisReportService reportService;

    @GetMapping
    public ResponseEntity<AnalysisReport> getAnalysis(@RequestParam(defaultValue = "all") String type) {
        return ResponseEntity.ok(reportService.buildReport(type));
    }
}

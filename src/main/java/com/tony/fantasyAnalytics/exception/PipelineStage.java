package com.tony.fantasyAnalytics.exception;

public enum PipelineStage {
    SCRAPE, IMPORT, TRAIN, PREDICT, QUERY
}

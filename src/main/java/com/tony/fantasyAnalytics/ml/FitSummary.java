package com.tony.fantasyAnalytics.ml;

public record FitSummary(int samples, int featureCount, double trainingMse, double[] featureImportances) {
}

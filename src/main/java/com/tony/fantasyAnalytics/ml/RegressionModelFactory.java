package com.tony.fantasyAnalytics.ml;

@FunctionalInterface
public interface RegressionModelFactory {

    RegressionModel create();
}

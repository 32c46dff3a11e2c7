package com.tony.fantasyAnalytics.feature;

import com.tony.fantasyAnalytics.model.AttributeEstimate;
import com.tony.fantasyAnalytics.model.Position;

@FunctionalInterface
public interface AttributeEstimator {

    AttributeEstimate estimate(String playerName, Position position);
}

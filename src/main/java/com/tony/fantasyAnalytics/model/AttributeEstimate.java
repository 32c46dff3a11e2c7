package com.tony.fantasyAnalytics.model;

/**
 * Âge / expérience synthétiques (aucune donnée biographique réelle disponible).
 */
public record AttributeEstimate(int age, int experience) {

    public static AttributeEstimate fromAge(int age) {
        return new AttributeEstimate(age, Math.max(1, age - 22));
    }
}

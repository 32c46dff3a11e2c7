package com.tony.fantasyAnalytics.model;

/**
 * D'où vient un exemple d'entraînement : joueur, poste retenu, saison des features, saison du label.
 */
public record TransitionProvenance(String player, Position position, int featureYear, int labelYear) {
}

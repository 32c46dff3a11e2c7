package com.tony.fantasyAnalytics.model;

import java.util.Locale;

public enum Position {
    QB, RB, WR, TE, OTHER;

    /**
     * Tolérant : "wr", " Wr " -> WR. Tout ce qui n'est pas QB/RB/WR/TE (K, FB, vide...) -> OTHER.
     */
    public static Position fromLabel(String label) {
        if (label == null || label.isBlank()) return OTHER;
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Position p : values()) {
            if (p != OTHER && p.name().equals(normalized)) return p;
        }
        return OTHER;
    }
}

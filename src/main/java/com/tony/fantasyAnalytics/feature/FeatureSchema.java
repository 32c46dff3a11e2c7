package com.tony.fantasyAnalytics.feature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Disposition unique et versionnée du vecteur de features, partagée par l'entraînement et l'inférence.
 * L'ordre des champs est un contrat : un modèle ne peut être interrogé qu'avec le schéma qui l'a entraîné.
 */
public enum FeatureSchema {

    V1_BASE("v1", List.of(
            "current_points", "weighted_points",
            "is_qb", "is_rb", "is_wr", "is_te",
            "age_factor", "experience_factor",
            "rb_age_risk", "wr_age_peak")),

    V2_EXTENDED("v2", List.of(
            "current_points", "weighted_points",
            "is_qb", "is_rb", "is_wr", "is_te",
            "age_factor", "experience_factor",
            "rb_age_risk", "wr_age_peak",
            "years_since_epoch", "team_consistency"));

    private final String version;
    private final List<String> featureNames;
    private final String schemaHash;

    FeatureSchema(String version, List<String> featureNames) {
        this.version = version;
        this.featureNames = featureNames;
        this.schemaHash = sha256(String.join("|", featureNames));
    }

    public String version() {
        return version;
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public int size() {
        return featureNames.size();
    }

    public String schemaHash() {
        return schemaHash;
    }

    public boolean includesTrend() {
        return this == V2_EXTENDED;
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
    }
}

package com.tony.fantasyAnalytics.ml.forest;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Nœud d'arbre aplati. feature = -1 pour une feuille ; sinon x[feature] <= threshold -> left.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TreeNode {
    private int feature;
    private double threshold;
    private int left;
    private int right;
    private double value;

    static TreeNode leaf(double value) {
        return new TreeNode(-1, 0.0, -1, -1, value);
    }

    boolean isLeaf() {
        return feature < 0;
    }
}

package com.sievesql.binding;

import java.util.Arrays;
import java.util.List;

/**
 * Builds the "did you mean" hints attached to name resolution errors.
 */
public final class Hints {

    private Hints() {
    }

    /**
     * Formats a list of alternatives: {@code did you mean: 'a', 'b' or 'c'}.
     *
     * @return the hint, or null if there are no choices
     */
    public static String choices(List<String> choices) {
        if (choices.isEmpty()) {
            return null;
        }
        StringBuilder hint = new StringBuilder("did you mean: ");
        if (choices.size() == 1) {
            return hint.append('\'').append(choices.get(0)).append('\'').toString();
        }
        for (int i = 0; i < choices.size() - 1; i++) {
            if (i > 0) {
                hint.append(", ");
            }
            hint.append('\'').append(choices.get(i)).append('\'');
        }
        return hint.append(" or '").append(choices.get(choices.size() - 1)).append('\'').toString();
    }

    /**
     * Checks whether {@code sample} looks like a misspelling of {@code model}:
     * either it extends the model, or their edit distance (with
     * transpositions) is within {@code 1 + length/5}.
     */
    public static boolean isSimilar(String model, String sample) {
        if (model.isEmpty() || sample.isEmpty()) {
            return false;
        }
        if (model.length() > 1 && sample.startsWith(model)) {
            return true;
        }
        int m = model.length();
        int n = sample.length();
        int threshold = 1 + m / 5;
        if (Math.abs(m - n) > threshold) {
            return false;
        }
        int infinity = threshold + 1;
        int[][] distance = new int[m + 1][n + 1];
        for (int[] row : distance) {
            Arrays.fill(row, infinity);
        }
        for (int i = 0; i <= Math.min(m, threshold); i++) {
            distance[i][0] = i;
        }
        for (int j = 0; j <= Math.min(n, threshold); j++) {
            distance[0][j] = j;
        }
        for (int i = 1; i <= m; i++) {
            for (int j = Math.max(1, i - threshold); j <= Math.min(n, i + threshold); j++) {
                int k = distance[i - 1][j - 1];
                if (model.charAt(i - 1) != sample.charAt(j - 1)) {
                    k += 1;
                }
                if (i > 1 && j > 1 && model.charAt(i - 2) == sample.charAt(j - 1)
                        && model.charAt(i - 1) == sample.charAt(j - 2)) {
                    k = Math.min(k, distance[i - 2][j - 2] + 1);
                }
                k = Math.min(k, Math.min(distance[i - 1][j] + 1, distance[i][j - 1] + 1));
                distance[i][j] = k;
            }
        }
        return distance[m][n] <= threshold;
    }
}

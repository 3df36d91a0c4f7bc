package com.geonamesfst.query;

/**
 * 按 Unicode 码点计算的 Levenshtein 编辑距离（插入、删除、替换代价均为 1）。
 */
public final class EditDistance {
    private EditDistance() {
    }

    public static int levenshtein(String left, String right) {
        int[] source = left.codePoints().toArray();
        int[] target = right.codePoints().toArray();
        if (source.length == 0) {
            return target.length;
        }
        if (target.length == 0) {
            return source.length;
        }

        int[] previous = new int[target.length + 1];
        int[] current = new int[target.length + 1];
        for (int j = 0; j <= target.length; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= source.length; i++) {
            current[0] = i;
            for (int j = 1; j <= target.length; j++) {
                int substitution = previous[j - 1] + (source[i - 1] == target[j - 1] ? 0 : 1);
                int deletion = previous[j] + 1;
                int insertion = current[j - 1] + 1;
                current[j] = Math.min(substitution, Math.min(deletion, insertion));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[target.length];
    }
}

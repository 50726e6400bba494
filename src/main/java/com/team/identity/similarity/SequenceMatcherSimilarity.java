package com.team.identity.similarity;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp "gestalt" similarity.
 *
 * <p>Finds the longest common block, recurses on the unmatched text to its left and right,
 * and scores {@code 2 * M / T} where M is the total size of all matched blocks and T the
 * combined length of both strings. Ties between equally long blocks go to the one starting
 * earliest in {@code s1}, then earliest in {@code s2}.</p>
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    @Override
    public String getName() {
        return "SequenceMatcher";
    }

    /**
     * Sums the sizes of all matching blocks between the two strings.
     */
    int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];

            int[] block = longestMatch(a, alo, ahi, b, blo, bhi);
            int i = block[0], j = block[1], size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                pending.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                pending.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest common substring of {@code a[alo, ahi)} and {@code b[blo, bhi)}.
     *
     * @return {start in a, start in b, length}
     */
    private int[] longestMatch(String a, int alo, int ahi, String b, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        // runLengths[j + 1] = length of the common run ending at a[i - 1], b[j]
        int[] previous = new int[bhi + 1];
        int[] current = new int[bhi + 1];

        for (int i = alo; i < ahi; i++) {
            char ca = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (ca == b.charAt(j)) {
                    int k = previous[j] + 1;
                    current[j + 1] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                } else {
                    current[j + 1] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}

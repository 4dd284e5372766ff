package com.netcracker.core.ddisync.service.mapping;

/**
 * Gestalt pattern matching similarity: {@code 2 * M / T}, where {@code M} is the number of characters in
 * matching blocks found by repeatedly taking the longest common block and recursing on both sides of it,
 * and {@code T} is the combined length of both strings.
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    static int matchingCharacters(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        if (aLow >= aHigh || bLow >= bHigh) {
            return 0;
        }
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        // lengths[j + 1] = length of the common suffix ending at a[i], b[j]
        int[] previous = new int[bHigh - bLow + 1];
        for (int i = aLow; i < aHigh; i++) {
            int[] current = new int[bHigh - bLow + 1];
            for (int j = bLow; j < bHigh; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = previous[j - bLow] + 1;
                    current[j - bLow + 1] = size;
                    // strict comparison keeps the block starting earliest in a, then in b
                    if (size > bestSize) {
                        bestI = i - size + 1;
                        bestJ = j - size + 1;
                        bestSize = size;
                    }
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLow, bestI, b, bLow, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHigh, b, bestJ + bestSize, bHigh);
    }
}

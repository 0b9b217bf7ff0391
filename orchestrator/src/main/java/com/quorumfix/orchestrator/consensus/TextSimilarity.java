package com.quorumfix.orchestrator.consensus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Whitespace-insensitive similarity between two proposed fixes.
 *
 * <p>Ratcliff/Obershelp matching: find the longest common block, recurse on
 * the text either side of it, and score {@code 2 * matched / (len(a) + len(b))}.
 * The algorithm is not symmetric for every input, so the score is the larger
 * of both directions. Result is in [0,1]; identical non-empty inputs score 1.0
 * and an empty or null input scores 0.0.
 *
 * <p>For texts of {@value #POPULAR_MIN_LENGTH} characters or more, characters
 * making up over 1% of the second text are "popular": they never seed a
 * block, only extend one. This keeps long diffs cheap to compare.
 */
public final class TextSimilarity {

    static final int POPULAR_MIN_LENGTH = 200;

    private TextSimilarity() {}

    public static double ratio(String first, String second) {
        if (first == null || second == null || first.isBlank() || second.isBlank()) {
            return 0.0;
        }
        String a = normalize(first);
        String b = normalize(second);
        if (a.equals(b)) {
            return 1.0;
        }
        int total = a.length() + b.length();
        int matched = Math.max(matchedChars(a, b), matchedChars(b, a));
        return 2.0 * matched / total;
    }

    /**
     * Cheap ceiling on {@link #ratio}: shared characters regardless of order.
     * A pair whose bound is below a threshold cannot reach it.
     */
    public static double upperBound(String first, String second) {
        if (first == null || second == null || first.isBlank() || second.isBlank()) {
            return 0.0;
        }
        String a = normalize(first);
        String b = normalize(second);
        Map<Character, Integer> available = new HashMap<>();
        for (int i = 0; i < b.length(); i++) {
            available.merge(b.charAt(i), 1, Integer::sum);
        }
        int shared = 0;
        for (int i = 0; i < a.length(); i++) {
            Integer left = available.get(a.charAt(i));
            if (left != null && left > 0) {
                available.put(a.charAt(i), left - 1);
                shared++;
            }
        }
        return 2.0 * shared / (a.length() + b.length());
    }

    /** Collapse every run of whitespace to a single space and trim. */
    public static String normalize(String text) {
        return String.join(" ", text.trim().split("\\s+"));
    }

    // ------------------------------------------------------------------
    // Matching blocks
    // ------------------------------------------------------------------

    static int matchedChars(String a, String b) {
        return new BlockMatcher(a, b).matchedChars();
    }

    /** Matching state for one (a, b) direction; the row buffers are reused across blocks. */
    private static final class BlockMatcher {

        private final String a;
        private final String b;
        // char -> ascending positions in b, popular chars left out
        private final Map<Character, int[]> positions;
        // run[j + 1] = length of the match ending at a[i], b[j]; all zero between blocks
        private int[] previous;
        private int[] current;
        private int[] previousTouched;
        private int[] currentTouched;

        BlockMatcher(String a, String b) {
            this.a = a;
            this.b = b;
            this.positions       = index(b);
            this.previous        = new int[b.length() + 1];
            this.current         = new int[b.length() + 1];
            this.previousTouched = new int[b.length()];
            this.currentTouched  = new int[b.length()];
        }

        private static Map<Character, int[]> index(String b) {
            Map<Character, Integer> sizes = new HashMap<>();
            for (int j = 0; j < b.length(); j++) {
                sizes.merge(b.charAt(j), 1, Integer::sum);
            }
            int popularAbove = b.length() >= POPULAR_MIN_LENGTH ? b.length() / 100 + 1 : Integer.MAX_VALUE;

            Map<Character, int[]> index = new HashMap<>();
            Map<Character, Integer> filled = new HashMap<>();
            for (int j = 0; j < b.length(); j++) {
                char c = b.charAt(j);
                int size = sizes.get(c);
                if (size > popularAbove) {
                    continue;
                }
                int[] slot = index.computeIfAbsent(c, k -> new int[size]);
                slot[filled.merge(c, 1, Integer::sum) - 1] = j;
            }
            return index;
        }

        int matchedChars() {
            int matched = 0;
            Deque<int[]> pending = new ArrayDeque<>();
            pending.push(new int[] {0, a.length(), 0, b.length()});

            while (!pending.isEmpty()) {
                int[] range = pending.pop();
                int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];

                int[] match = longestMatch(alo, ahi, blo, bhi);
                int i = match[0], j = match[1], size = match[2];
                if (size == 0) {
                    continue;
                }
                matched += size;
                if (alo < i && blo < j) {
                    pending.push(new int[] {alo, i, blo, j});
                }
                if (i + size < ahi && j + size < bhi) {
                    pending.push(new int[] {i + size, ahi, j + size, bhi});
                }
            }
            return matched;
        }

        /**
         * Longest common block of {@code a[alo,ahi)} and {@code b[blo,bhi)} seeded
         * by non-popular characters, then extended over any equal neighbours.
         * Ties go to the block starting earliest in {@code a}, then in {@code b}.
         *
         * @return {@code {startA, startB, length}}
         */
        private int[] longestMatch(int alo, int ahi, int blo, int bhi) {
            int bestI = alo, bestJ = blo, bestSize = 0;
            int previousCount = 0;

            for (int i = alo; i < ahi; i++) {
                int currentCount = 0;
                int[] js = positions.get(a.charAt(i));
                if (js != null) {
                    for (int j : js) {
                        if (j < blo) {
                            continue;
                        }
                        if (j >= bhi) {
                            break;
                        }
                        int k = previous[j] + 1;
                        current[j + 1] = k;
                        currentTouched[currentCount++] = j + 1;
                        if (k > bestSize) {
                            bestI = i - k + 1;
                            bestJ = j - k + 1;
                            bestSize = k;
                        }
                    }
                }
                clear(previous, previousTouched, previousCount);
                swapRows();
                previousCount = currentCount;
            }
            clear(previous, previousTouched, previousCount);

            while (bestI > alo && bestJ > blo && a.charAt(bestI - 1) == b.charAt(bestJ - 1)) {
                bestI--;
                bestJ--;
                bestSize++;
            }
            while (bestI + bestSize < ahi && bestJ + bestSize < bhi
                    && a.charAt(bestI + bestSize) == b.charAt(bestJ + bestSize)) {
                bestSize++;
            }
            return new int[] {bestI, bestJ, bestSize};
        }

        private void swapRows() {
            int[] row = previous;
            previous = current;
            current = row;
            int[] touched = previousTouched;
            previousTouched = currentTouched;
            currentTouched = touched;
        }

        private static void clear(int[] row, int[] touched, int count) {
            for (int t = 0; t < count; t++) {
                row[touched[t]] = 0;
            }
        }
    }
}

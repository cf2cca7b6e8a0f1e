package droidtap.ocr;

/**
 * Ratcliff/Obershelp similarity: twice the number of characters in matching
 * blocks divided by the total length of both strings.
 */
public final class TextSimilarity {

    private TextSimilarity() {}

    /**
     * @return similarity in {@code [0.0, 1.0]}; two empty strings are identical
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingChars(a, 0, a.length(), b, 0, b.length()) / total;
    }

    /**
     * Length of the longest common block in the given ranges plus, recursively,
     * the matches to its left and to its right.
     */
    private static int matchingChars(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) return 0;

        int bestLen = 0;
        int bestA = aLo;
        int bestB = bLo;
        int[] prev = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] cur = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int len = prev[j - bLo] + 1;
                    cur[j - bLo + 1] = len;
                    if (len > bestLen) {
                        bestLen = len;
                        bestA = i - len + 1;
                        bestB = j - len + 1;
                    }
                }
            }
            prev = cur;
        }
        if (bestLen == 0) return 0;

        return bestLen
                + matchingChars(a, aLo, bestA, b, bLo, bestB)
                + matchingChars(a, bestA + bestLen, aHi, b, bestB + bestLen, bHi);
    }
}

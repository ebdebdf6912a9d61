package co.elastic.policycheck.tree;

import java.util.Comparator;

/**
 * Orders map keys so that runs of digits compare by numeric value ({@code componentid-2} before
 * {@code componentid-10}). Keys that only differ in leading zeros fall back to plain string order, keeping
 * the ordering total.
 */
public final class NaturalKeyOrder implements Comparator<String> {
    public static final NaturalKeyOrder INSTANCE = new NaturalKeyOrder();

    private NaturalKeyOrder() {}

    @Override
    public int compare(String left, String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            char a = left.charAt(i);
            char b = right.charAt(j);
            if (isDigit(a) && isDigit(b)) {
                int endA = digitRunEnd(left, i);
                int endB = digitRunEnd(right, j);
                int result = compareDigitRuns(left.substring(i, endA), right.substring(j, endB));
                if (result != 0) {
                    return result;
                }
                i = endA;
                j = endB;
                continue;
            }
            if (a != b) {
                return Character.compare(a, b);
            }
            i++;
            j++;
        }
        if (i < left.length()) {
            return 1;
        }
        if (j < right.length()) {
            return -1;
        }
        return left.compareTo(right);
    }

    private static int compareDigitRuns(String a, String b) {
        String strippedA = stripLeadingZeros(a);
        String strippedB = stripLeadingZeros(b);
        if (strippedA.length() != strippedB.length()) {
            return Integer.compare(strippedA.length(), strippedB.length());
        }
        return strippedA.compareTo(strippedB);
    }

    private static String stripLeadingZeros(String digits) {
        int index = 0;
        while (index < digits.length() - 1 && digits.charAt(index) == '0') {
            index++;
        }
        return digits.substring(index);
    }

    private static int digitRunEnd(String text, int start) {
        int end = start;
        while (end < text.length() && isDigit(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

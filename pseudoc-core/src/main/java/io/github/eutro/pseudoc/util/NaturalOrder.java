package io.github.eutro.pseudoc.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders strings by their alternating runs of non-digits and digits,
 * comparing digit runs by numeric value, so {@code "r2"} sorts before {@code "r10"}.
 * <p>
 * Strings whose runs are all equal are ordered as plain strings, so this is
 * consistent with {@link String#equals(Object)}.
 */
public final class NaturalOrder implements Comparator<String> {
    public static final NaturalOrder INSTANCE = new NaturalOrder();

    private NaturalOrder() {
    }

    /**
     * Split a string into runs, starting with a (possibly empty) non-digit run,
     * and alternating after that.
     *
     * @param s The string.
     * @return The runs.
     */
    static List<String> split(String s) {
        List<String> runs = new ArrayList<>();
        int start = 0;
        boolean digits = false;
        for (int i = 0; i < s.length(); i++) {
            if (isDigit(s.charAt(i)) != digits) {
                runs.add(s.substring(start, i));
                start = i;
                digits = !digits;
            }
        }
        runs.add(s.substring(start));
        return runs;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    @Override
    public int compare(String a, String b) {
        List<String> ra = split(a);
        List<String> rb = split(b);
        int n = Math.min(ra.size(), rb.size());
        for (int i = 0; i < n; i++) {
            // odd runs are the digit runs
            int c = (i & 1) == 1
                    ? compareNumeric(ra.get(i), rb.get(i))
                    : ra.get(i).compareTo(rb.get(i));
            if (c != 0) return c;
        }
        if (ra.size() != rb.size()) return Integer.compare(ra.size(), rb.size());
        // "r01" and "r1" are distinct names
        return a.compareTo(b);
    }

    private static int compareNumeric(String a, String b) {
        a = stripZeros(a);
        b = stripZeros(b);
        if (a.length() != b.length()) return Integer.compare(a.length(), b.length());
        return a.compareTo(b);
    }

    private static String stripZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') i++;
        return digits.substring(i);
    }
}

package tech.keyledger.release;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Orders dotted version strings numerically segment by segment ({@code 1.10.0 > 1.9.2}).
 * Missing segments count as zero. Within a segment the leading number decides first, then
 * a bare number outranks a qualified one ({@code 1.0.0 > 1.0.0-beta}) and qualifiers
 * compare as strings.
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    private VersionComparator() {
    }

    public static boolean isNewer(String candidate, String current) {
        if (current == null || current.isBlank()) {
            return true;
        }
        return INSTANCE.compare(candidate, current) > 0;
    }

    @Override
    public int compare(String a, String b) {
        String[] left = strip(a).split("\\.");
        String[] right = strip(b).split("\\.");
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            String l = i < left.length ? left[i] : "0";
            String r = i < right.length ? right[i] : "0";
            int cmp = compareSegment(l, r);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int compareSegment(String l, String r) {
        int ld = digitPrefix(l);
        int rd = digitPrefix(r);
        BigInteger ln = ld == 0 ? BigInteger.valueOf(-1) : new BigInteger(l.substring(0, ld));
        BigInteger rn = rd == 0 ? BigInteger.valueOf(-1) : new BigInteger(r.substring(0, rd));
        int cmp = ln.compareTo(rn);
        if (cmp != 0) {
            return cmp;
        }
        String ls = l.substring(ld);
        String rs = r.substring(rd);
        if (ls.isEmpty() || rs.isEmpty()) {
            // A bare number outranks the same number with a qualifier
            return Boolean.compare(ls.isEmpty(), rs.isEmpty());
        }
        return ls.compareTo(rs);
    }

    private static int digitPrefix(String s) {
        int i = 0;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String strip(String version) {
        String v = version == null ? "" : version.trim();
        return v.startsWith("v") || v.startsWith("V") ? v.substring(1) : v;
    }
}

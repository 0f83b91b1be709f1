package json.nodes;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/// Locale-independent floating-point prefix scanner with C `strtod` semantics.
///
/// Accepts an optional sign followed by one of: a decimal significand with
/// optional fraction and `e` exponent, a `0x` hexadecimal significand with
/// optional fraction and `p` exponent, `inf`, `infinity`, or `nan` (with an
/// optional parenthesised tag), all case-insensitive. An exponent marker not
/// followed by digits is not part of the number. The scan never reads at or
/// past `limit`.
final class NumberScanner {

    private NumberScanner() {}

    /// {@return the length of the longest numeric prefix of `doc` starting at
    /// `start`, or zero if there is none}
    static int prefixLength(byte[] doc, int start, int limit) {
        int i = start;
        if (i < limit && (doc[i] == '-' || doc[i] == '+')) {
            i++;
        }
        int word = wordLength(doc, i, limit);
        if (word > 0) {
            return i + word - start;
        }
        if (i + 1 < limit && doc[i] == '0' && (doc[i + 1] == 'x' || doc[i + 1] == 'X')) {
            int hex = hexLength(doc, i + 2, limit);
            if (hex > 0) {
                return i + 2 + hex - start;
            }
            // "0x" with no hex digits scans as the single digit zero
        }
        int digits = 0;
        while (i < limit && isDigit(doc[i])) {
            i++;
            digits++;
        }
        if (i < limit && doc[i] == '.') {
            int j = i + 1;
            int fraction = 0;
            while (j < limit && isDigit(doc[j])) {
                j++;
                fraction++;
            }
            if (digits + fraction > 0) {
                i = j;
                digits += fraction;
            }
        }
        if (digits == 0) {
            return 0;
        }
        return exponentEnd(doc, i, limit, 'e') - start;
    }

    /// {@return the value of a prefix previously measured by
    /// {@link #prefixLength(byte[], int, int)}}
    static double valueOf(byte[] doc, int start, int length) {
        String text = new String(doc, start, length, StandardCharsets.US_ASCII);
        int bodyStart = text.charAt(0) == '-' || text.charAt(0) == '+' ? 1 : 0;
        boolean negative = text.charAt(0) == '-';
        String body = text.substring(bodyStart).toLowerCase(Locale.ROOT);
        if (body.startsWith("inf")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (body.startsWith("nan")) {
            return Double.NaN;
        }
        if (body.startsWith("0x") && body.indexOf('p') < 0) {
            // Java requires the binary exponent on hexadecimal literals
            text = text + "p0";
        }
        return Double.parseDouble(text);
    }

    private static int wordLength(byte[] doc, int from, int limit) {
        if (matchesIgnoreCase(doc, from, limit, "infinity")) {
            return 8;
        }
        if (matchesIgnoreCase(doc, from, limit, "inf")) {
            return 3;
        }
        if (matchesIgnoreCase(doc, from, limit, "nan")) {
            int i = from + 3;
            if (i < limit && doc[i] == '(') {
                int j = i + 1;
                while (j < limit && (isDigit(doc[j]) || isLetter(doc[j]) || doc[j] == '_')) {
                    j++;
                }
                if (j < limit && doc[j] == ')') {
                    return j + 1 - from;
                }
            }
            return 3;
        }
        return 0;
    }

    private static int hexLength(byte[] doc, int from, int limit) {
        int i = from;
        int digits = 0;
        while (i < limit && isHexDigit(doc[i])) {
            i++;
            digits++;
        }
        if (i < limit && doc[i] == '.') {
            int j = i + 1;
            int fraction = 0;
            while (j < limit && isHexDigit(doc[j])) {
                j++;
                fraction++;
            }
            if (digits + fraction > 0) {
                i = j;
                digits += fraction;
            }
        }
        if (digits == 0) {
            return 0;
        }
        return exponentEnd(doc, i, limit, 'p') - from;
    }

    // returns `from` unchanged unless a complete exponent follows
    private static int exponentEnd(byte[] doc, int from, int limit, char marker) {
        if (from >= limit || Character.toLowerCase((char) (doc[from] & 0xFF)) != marker) {
            return from;
        }
        int j = from + 1;
        if (j < limit && (doc[j] == '-' || doc[j] == '+')) {
            j++;
        }
        if (j >= limit || !isDigit(doc[j])) {
            return from;
        }
        while (j < limit && isDigit(doc[j])) {
            j++;
        }
        return j;
    }

    private static boolean matchesIgnoreCase(byte[] doc, int from, int limit, String word) {
        if (from + word.length() > limit) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            int c = doc[from + i] & 0xFF;
            if (c >= 'A' && c <= 'Z') {
                c += 'a' - 'A';
            }
            if (c != word.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    private static boolean isLetter(byte b) {
        return b >= 'a' && b <= 'z' || b >= 'A' && b <= 'Z';
    }

    private static boolean isHexDigit(byte b) {
        return isDigit(b) || b >= 'a' && b <= 'f' || b >= 'A' && b <= 'F';
    }
}

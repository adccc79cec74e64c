package org.esa.bandsim.io;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal helpers for the comma separated tables read and written here.
 *
 * @author bandsim team
 */
class CsvSupport {

    static final char SEPARATOR = ',';
    private static final char QUOTE = '"';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private CsvSupport() {
    }

    static boolean isSkippable(String line) {
        final String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    /**
     * Splits a line into its fields. Separators inside double quotes are part of the field,
     * a doubled quote inside a quoted field stands for one quote. Fields are trimmed.
     */
    static String[] split(String line) {
        List<String> tokens = new ArrayList<String>();
        StringBuilder token = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        token.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    token.append(c);
                }
            } else if (c == QUOTE) {
                quoted = true;
            } else if (c == SEPARATOR) {
                tokens.add(token.toString().trim());
                token.setLength(0);
            } else {
                token.append(c);
            }
        }
        tokens.add(token.toString().trim());
        return tokens.toArray(new String[tokens.size()]);
    }

    /**
     * @return the line without a leading UTF-8 byte order mark
     */
    static String stripByteOrderMark(String line) {
        if (line != null && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
            return line.substring(1);
        }
        return line;
    }

    /**
     * @return the value, NaN for empty cells and the usual missing value markers
     * @throws NumberFormatException if the cell is neither a number nor a missing value marker
     */
    static double parseValue(String token) {
        final String value = token.trim();
        if (value.isEmpty()) {
            return Double.NaN;
        }
        final String lower = value.toLowerCase(Locale.ENGLISH);
        if (lower.equals("nan") || lower.equals("na") || lower.equals("null") || lower.equals("none")) {
            return Double.NaN;
        }
        return Double.parseDouble(value);
    }

    /**
     * @return the value in plain decimal notation, an empty field for NaN
     */
    static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        if (Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }
}

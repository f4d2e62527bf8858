package com.bmsedge.cbcr.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.List;

/**
 * Turns raw spreadsheet cell values into text and numbers that are safe to
 * place in the generated document. None of these helpers throw on bad input.
 */
public class CellValueUtil {

    public static final String NOT_AVAILABLE = "N/A";

    // Tried in order, first match wins
    private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
            strict("uuuu-M-d"),
            strict("d/M/uuuu"),
            strict("M/d/uuuu"),
            strict("d-M-uuuu"),
            strict("uuuu/M/d")
    );

    private static final DateTimeFormatter CANONICAL_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private CellValueUtil() {
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Normalize a date cell to {@code yyyy-MM-dd}. Native date values are
     * formatted directly; text is matched against the supported patterns.
     * Unparseable input comes back unchanged.
     */
    public static String formatDate(Object raw) {
        if (raw == null) return null;
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).format(CANONICAL_DATE);
        }
        if (raw instanceof LocalDateTime) {
            return ((LocalDateTime) raw).toLocalDate().format(CANONICAL_DATE);
        }
        if (raw instanceof Date) {
            return ((Date) raw).toInstant().atZone(ZoneId.systemDefault()).toLocalDate().format(CANONICAL_DATE);
        }

        String text = toText(raw);
        for (DateTimeFormatter pattern : DATE_PATTERNS) {
            try {
                return LocalDate.parse(text.trim(), pattern).format(CANONICAL_DATE);
            } catch (DateTimeParseException e) {
                // try next pattern
            }
        }
        return text;
    }

    /**
     * Lenient integer coercion. Missing cells and anything that is not a
     * plain (optionally negative, optionally decimal) number become 0;
     * decimals are truncated.
     */
    public static long coerceInteger(Object raw) {
        if (raw == null) return 0L;

        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return 0L;
            }
            return (long) value;
        }
        if (!(raw instanceof String)) {
            return 0L;
        }

        String text = ((String) raw).trim();
        String digits = text.startsWith("-") ? text.substring(1) : text;
        int dot = digits.indexOf('.');
        if (dot >= 0) {
            digits = digits.substring(0, dot) + digits.substring(dot + 1);
        }
        if (!isAllDigits(digits)) {
            return 0L;
        }
        try {
            return (long) Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static boolean isAllDigits(String value) {
        if (value.isEmpty()) return false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Escape text for use as XML element content.
     */
    public static String escapeXml(String text) {
        if (text == null) return "";
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    escaped.append("&amp;");
                    break;
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                default:
                    if (isXmlChar(c)) {
                        escaped.append(c);
                    }
            }
        }
        return escaped.toString();
    }

    /**
     * Escape text for use inside a double-quoted XML attribute.
     */
    public static String escapeXmlAttribute(String text) {
        return escapeXml(text).replace("\"", "&quot;").replace("'", "&apos;");
    }

    // Control characters other than tab, CR and LF cannot appear in XML 1.0
    private static boolean isXmlChar(char c) {
        return c >= 0x20 || c == '\t' || c == '\n' || c == '\r';
    }

    /**
     * Plain text form of a cell value. Whole numbers lose their trailing
     * {@code .0}; missing values become an empty string.
     */
    public static String toText(Object raw) {
        if (raw == null) return "";
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
                return String.valueOf((long) value);
            }
            return String.valueOf(value);
        }
        if (raw instanceof LocalDateTime || raw instanceof LocalDate || raw instanceof Date) {
            return formatDate(raw);
        }
        return String.valueOf(raw).trim();
    }

    /**
     * Text of a cell, or {@code defaultValue} when the cell is missing or blank.
     */
    public static String textOrDefault(Object raw, String defaultValue) {
        String text = toText(raw);
        return text.isEmpty() ? defaultValue : text;
    }

    public static boolean isMissing(Object raw) {
        if (raw == null) return true;
        if (raw instanceof Double && ((Double) raw).isNaN()) return true;
        return raw instanceof String && ((String) raw).trim().isEmpty();
    }
}

package com.example.pricing_import.standardize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locale-tolerant price parsing.
 *
 * <p>Decimal mark rules:
 * <ul>
 * <li>both {@code ,} and {@code .} present: the last one is the decimal mark</li>
 * <li>one mark occurring more than once: grouping</li>
 * <li>one mark, not exactly three trailing digits: decimal</li>
 * <li>one mark, exactly three trailing digits: grouping unless the leading group
 * cannot be a thousands group; otherwise the currency symbol position decides
 * (leading symbol: {@code ,} groups; trailing symbol: {@code .} groups); without
 * a symbol the value is ambiguous</li>
 * </ul>
 */
public final class PriceParser {

    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();

    static {
        SYMBOLS.put("US$", "USD");
        SYMBOLS.put("$", "USD");
        SYMBOLS.put("£", "GBP");
        SYMBOLS.put("€", "EUR");
        SYMBOLS.put("¥", "JPY");
        SYMBOLS.put("₹", "INR");
    }

    private static final Pattern ISO_CODE = Pattern.compile("(?i)(?<![A-Z])([A-Z]{3})(?![A-Z])");
    private static final Pattern DIGITS_AND_MARKS = Pattern.compile("[.,]?[0-9][0-9.,]*");
    private static final Pattern STRIP = Pattern.compile("[\\s\\u00A0\\u202F'’]");

    private PriceParser() {
    }

    public static ParsedPrice parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedPrice.failed(ParsedPrice.Failure.UNPARSEABLE, null);
        }
        String text = STRIP.matcher(raw).replaceAll("");

        // currency marker and where it sits relative to the number
        String currency = null;
        Boolean markerLeading = null;
        for (Map.Entry<String, String> e : SYMBOLS.entrySet()) {
            int idx = text.indexOf(e.getKey());
            if (idx >= 0) {
                currency = e.getValue();
                markerLeading = idx < firstDigit(text);
                text = text.substring(0, idx) + text.substring(idx + e.getKey().length());
                break;
            }
        }
        Matcher iso = ISO_CODE.matcher(text);
        if (iso.find()) {
            String code = iso.group(1).toUpperCase(Locale.ROOT);
            if (currency == null) {
                currency = code;
                markerLeading = iso.start() < firstDigit(text);
            }
            text = text.substring(0, iso.start()) + text.substring(iso.end());
        }

        boolean negative = false;
        if (text.startsWith("(") && text.endsWith(")")) {
            negative = true;
            text = text.substring(1, text.length() - 1);
        }
        if (text.startsWith("-")) {
            negative = true;
            text = text.substring(1);
        } else if (text.startsWith("+")) {
            text = text.substring(1);
        }

        if (!DIGITS_AND_MARKS.matcher(text).matches()) {
            return ParsedPrice.failed(ParsedPrice.Failure.UNPARSEABLE, currency);
        }

        String canonical = canonicalize(text, markerLeading);
        if (canonical == null) {
            return ParsedPrice.failed(ParsedPrice.Failure.UNPARSEABLE, currency);
        }

        BigDecimal amount = new BigDecimal(canonical);
        if (negative && amount.signum() != 0) {
            return ParsedPrice.failed(ParsedPrice.Failure.NEGATIVE, currency);
        }
        return ParsedPrice.of(withMinimumScale(amount), currency);
    }

    /**
     * Parses a value that is already a plain decimal number, such as a numeric spreadsheet cell.
     * No separator heuristics apply, so no value is ambiguous.
     */
    public static ParsedPrice parseNumeric(String plain) {
        if (plain == null || plain.isBlank()) {
            return ParsedPrice.failed(ParsedPrice.Failure.UNPARSEABLE, null);
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(plain.trim());
        } catch (NumberFormatException e) {
            return ParsedPrice.failed(ParsedPrice.Failure.UNPARSEABLE, null);
        }
        if (amount.signum() < 0) {
            return ParsedPrice.failed(ParsedPrice.Failure.NEGATIVE, null);
        }
        return ParsedPrice.of(withMinimumScale(amount), null);
    }

    /**
     * ISO code for a bare currency symbol such as {@code £}, or null.
     */
    static String currencyForSymbol(String symbol) {
        return symbol == null ? null : SYMBOLS.get(symbol.trim());
    }

    private static BigDecimal withMinimumScale(BigDecimal amount) {
        return amount.scale() < 2 ? amount.setScale(2, RoundingMode.UNNECESSARY) : amount;
    }

    /**
     * Rewrites the number with '.' as decimal mark and no grouping, or null when ambiguous/malformed.
     */
    static String canonicalize(String number, Boolean markerLeading) {
        if (number.endsWith(".") || number.endsWith(",")) {
            return null;
        }
        int lastComma = number.lastIndexOf(',');
        int lastPeriod = number.lastIndexOf('.');

        if (lastComma >= 0 && lastPeriod >= 0) {
            char decimal = lastComma > lastPeriod ? ',' : '.';
            char grouping = decimal == ',' ? '.' : ',';
            int decimalIdx = Math.max(lastComma, lastPeriod);
            if (number.indexOf(decimal) != decimalIdx) {
                return null;
            }
            String intPart = number.substring(0, decimalIdx);
            if (!validGrouping(intPart, grouping)) {
                return null;
            }
            return intPart.replace(String.valueOf(grouping), "") + "." + number.substring(decimalIdx + 1);
        }

        char mark = lastComma >= 0 ? ',' : lastPeriod >= 0 ? '.' : 0;
        if (mark == 0) {
            return number;
        }
        int occurrences = (int) number.chars().filter(c -> c == mark).count();
        if (occurrences > 1) {
            return validGrouping(number, mark) ? number.replace(String.valueOf(mark), "") : null;
        }

        int idx = number.indexOf(mark);
        String lead = number.substring(0, idx);
        String tail = number.substring(idx + 1);
        if (tail.length() != 3 || lead.isEmpty() || lead.length() > 3 || lead.startsWith("0")) {
            return (lead.isEmpty() ? "0" : lead) + "." + tail;
        }
        if (markerLeading == null) {
            return null;
        }
        boolean grouping = markerLeading ? mark == ',' : mark == '.';
        return grouping ? lead + tail : lead + "." + tail;
    }

    private static boolean validGrouping(String intPart, char grouping) {
        String[] groups = intPart.split(Pattern.quote(String.valueOf(grouping)), -1);
        if (groups.length == 1) {
            return !intPart.isEmpty();
        }
        if (groups[0].isEmpty() || groups[0].length() > 3) {
            return false;
        }
        for (int i = 1; i < groups.length; i++) {
            if (groups[i].length() != 3) {
                return false;
            }
        }
        return true;
    }

    private static int firstDigit(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return i;
            }
        }
        return text.length();
    }
}

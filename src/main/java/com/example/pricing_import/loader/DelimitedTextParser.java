package com.example.pricing_import.loader;

import java.util.ArrayList;
import java.util.List;

/**
 * Delimited text parsing (quotes and escapes supported).
 * Inside double quotes, {@code ""} is an escaped quote and delimiters/newlines are literal.
 */
final class DelimitedTextParser {

    private static final char[] CANDIDATE_DELIMITERS = { ',', ';', '\t', '|' };
    private static final int SNIFF_LINES = 10;

    private DelimitedTextParser() {
    }

    /**
     * Picks the candidate delimiter seen most often outside quotes in the first lines.
     */
    static char sniffDelimiter(String text) {
        int[] counts = new int[CANDIDATE_DELIMITERS.length];
        int lines = 0;
        for (String line : text.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            boolean inQuotes = false;
            for (char c : line.toCharArray()) {
                if (c == '"') {
                    inQuotes = !inQuotes;
                } else if (!inQuotes) {
                    for (int i = 0; i < CANDIDATE_DELIMITERS.length; i++) {
                        if (c == CANDIDATE_DELIMITERS[i]) {
                            counts[i]++;
                        }
                    }
                }
            }
            if (++lines >= SNIFF_LINES) {
                break;
            }
        }
        int best = 0;
        for (int i = 1; i < counts.length; i++) {
            if (counts[i] > counts[best]) {
                best = i;
            }
        }
        return CANDIDATE_DELIMITERS[best];
    }

    /**
     * Splits the whole text into records; each record is a list of raw field strings.
     */
    static List<List<String>> parse(String text, char delimiter) {
        List<List<String>> records = new ArrayList<>();
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        char[] chars = text.toCharArray();

        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];

            if (inQuotes) {
                if (c == '"') {
                    // "" is an escaped quote
                    if (i + 1 < chars.length && chars[i + 1] == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == delimiter) {
                values.add(current.toString());
                current = new StringBuilder();
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < chars.length && chars[i + 1] == '\n') {
                    i++;
                }
                values.add(current.toString());
                records.add(values);
                values = new ArrayList<>();
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0 || !values.isEmpty()) {
            values.add(current.toString());
            records.add(values);
        }
        return records;
    }
}

package com.product.resolution.bulk;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Minimal RFC 4180 helpers: quoted fields, doubled quotes and commas inside quotes.
 * A quoted field spanning several lines is not supported.
 */
final class CsvSupport {

    private CsvSupport() {
    }

    /**
     * Splits one CSV line into fields.
     *
     * @throws IllegalArgumentException if a quoted field is not closed on the line
     */
    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
            i++;
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted field");
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Maps lower-cased header names to column positions; a leading BOM is ignored.
     */
    static Map<String, Integer> headerIndex(String headerLine) {
        String header = headerLine.startsWith("\uFEFF") ? headerLine.substring(1) : headerLine;
        Map<String, Integer> index = new HashMap<>();
        List<String> names = parseLine(header);
        for (int i = 0; i < names.size(); i++) {
            index.putIfAbsent(names.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        return index;
    }

    /**
     * Returns the value of the first present column among {@code names}, trimmed, or {@code ""}.
     */
    static String field(List<String> row, Map<String, Integer> header, String... names) {
        for (String name : names) {
            Integer position = header.get(name);
            if (position != null && position < row.size()) {
                return row.get(position).trim();
            }
        }
        return "";
    }

    static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}

package com.stockledger.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders rows as a plain-text grid:
 * <pre>
 * +----+-------+
 * | ID | Name  |
 * +====+=======+
 * | 1  | Mouse |
 * +----+-------+
 * </pre>
 */
public final class TableRenderer {

    private TableRenderer() {
    }

    public static String render(List<String> headers, List<List<?>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        List<List<String>> cells = new ArrayList<>();
        for (List<?> row : rows) {
            List<String> line = new ArrayList<>();
            for (int i = 0; i < headers.size(); i++) {
                Object value = i < row.size() ? row.get(i) : null;
                String text = value == null ? "" : value.toString();
                widths[i] = Math.max(widths[i], text.length());
                line.add(text);
            }
            cells.add(line);
        }

        StringBuilder sb = new StringBuilder();
        appendBorder(sb, widths, '-');
        appendRow(sb, widths, headers);
        appendBorder(sb, widths, '=');
        for (List<String> line : cells) {
            appendRow(sb, widths, line);
            appendBorder(sb, widths, '-');
        }
        if (cells.isEmpty()) {
            // header-only table still gets a closing border
            appendBorder(sb, widths, '-');
        }
        return sb.toString();
    }

    private static void appendBorder(StringBuilder sb, int[] widths, char fill) {
        sb.append('+');
        for (int width : widths) {
            sb.append(String.valueOf(fill).repeat(width + 2)).append('+');
        }
        sb.append('\n');
    }

    private static void appendRow(StringBuilder sb, int[] widths, List<String> values) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String value = values.get(i);
            sb.append(' ').append(value).append(" ".repeat(widths[i] - value.length())).append(" |");
        }
        sb.append('\n');
    }
}

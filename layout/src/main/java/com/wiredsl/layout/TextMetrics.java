package com.wiredsl.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Rough monospace-style text measurement: a character is 0.6 of the font size wide.
 */
public final class TextMetrics {

    private static final double CHAR_WIDTH_FACTOR = 0.6;

    private TextMetrics() {}

    /**
     * Greedy word wrap. Words longer than a line are broken; blank paragraphs keep an empty line.
     */
    public static List<String> wrap(String text, double maxWidth, double fontSize) {
        String normalized = text == null ? "" : text.replace("\r\n", "\n");
        double charWidth = fontSize * CHAR_WIDTH_FACTOR;
        double safeWidth = Math.max(maxWidth, charWidth);
        int maxChars = Math.max(1, (int) Math.floor(safeWidth / charWidth));

        List<String> lines = new ArrayList<>();
        for (String paragraph : normalized.split("\n", -1)) {
            if (paragraph.isBlank()) {
                lines.add("");
                continue;
            }

            StringBuilder current = new StringBuilder();
            for (String word : paragraph.trim().split("\\s+")) {
                int candidate = current.length() == 0 ? word.length() : current.length() + 1 + word.length();
                if (candidate <= maxChars) {
                    if (current.length() > 0) {
                        current.append(' ');
                    }
                    current.append(word);
                    continue;
                }

                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                if (word.length() <= maxChars) {
                    current.append(word);
                    continue;
                }
                for (int i = 0; i < word.length(); i += maxChars) {
                    lines.add(word.substring(i, Math.min(word.length(), i + maxChars)));
                }
            }
            if (current.length() > 0) {
                lines.add(current.toString());
            }
        }
        return lines.isEmpty() ? List.of("") : lines;
    }

    public static int lineCount(String text, double maxWidth, double fontSize) {
        return Math.max(1, wrap(text, maxWidth, fontSize).size());
    }
}

package labelbuilder.label.builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width line splitting. No word boundaries, no hyphenation.
 */
public final class TextSplitter {

    private TextSplitter() {
    }

    /**
     * Slices {@code text} left to right into runs of at most {@code maxLength} code points.
     * Empty or {@code null} text yields a single empty line.
     */
    public static List<String> split(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("Maximum line length must be greater than 0, was " + maxLength);
        }
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            lines.add("");
            return lines;
        }
        int start = 0;
        while (start < text.length()) {
            int remaining = text.codePointCount(start, text.length());
            int end = remaining > maxLength ? text.offsetByCodePoints(start, maxLength) : text.length();
            lines.add(text.substring(start, end));
            start = end;
        }
        return lines;
    }
}

package dev.scriptorium.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Header-aware Markdown chunker that guarantees a maximum chunk length.
 *
 * <p>The document is first cut at H1 lines. Every segment that is still longer than the limit is cut
 * at H2 lines, then at H3 lines; a segment is emitted at the first level where it fits. A segment
 * that is too long after H3 is cut into fixed windows of {@code maxLen} characters. Segments are
 * trimmed and blank ones dropped, so concatenating the chunks gives back the document up to
 * whitespace at the cut points.
 *
 * <p>A header line is a line whose first non-blank run is exactly N {@code #} characters followed by
 * a space and some text. Text before the first header of a level forms its own segment. H4+ headings
 * never cut.
 */
@Component
public class MarkdownChunker {

    /** Cut points in priority order: index 0 = H1, 1 = H2, 2 = H3. */
    static final List<Pattern> HEADER_LEVELS = List.of(headerLine(1), headerLine(2), headerLine(3));

    private static Pattern headerLine(int level) {
        return Pattern.compile("^[ \\t]*#{" + level + "}[ \\t]+\\S", Pattern.MULTILINE);
    }

    /**
     * Chunks a Markdown document.
     *
     * @param markdown the Markdown text; null or blank yields no chunks
     * @param maxLen the maximum chunk length in characters, positive
     * @return chunk texts in document order, each 1..maxLen characters long
     */
    public List<String> chunk(@Nullable String markdown, int maxLen) {
        if (maxLen <= 0) {
            throw new IllegalArgumentException("maxLen must be positive, got " + maxLen);
        }
        if (markdown == null || markdown.isBlank()) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        splitAtLevel(markdown, 0, maxLen, chunks);
        return chunks;
    }

    /**
     * Cuts {@code text} at the header lines of {@code level} and places each piece: pieces that fit are
     * emitted, the rest go one level deeper or, past H3, to the hard splitter.
     */
    private void splitAtLevel(String text, int level, int maxLen, List<String> chunks) {
        for (String segment : splitByHeader(text, HEADER_LEVELS.get(level))) {
            if (segment.length() <= maxLen) {
                chunks.add(segment);
            } else if (level + 1 < HEADER_LEVELS.size()) {
                splitAtLevel(segment, level + 1, maxLen, chunks);
            } else {
                chunks.addAll(hardSplit(segment, maxLen));
            }
        }
    }

    /**
     * Splits text at the start of each line matching {@code headerPattern}. Returns trimmed, non-blank
     * segments; the text before the first match is the first segment.
     */
    static List<String> splitByHeader(String text, Pattern headerPattern) {
        List<Integer> cuts = new ArrayList<>();
        cuts.add(0);
        Matcher matcher = headerPattern.matcher(text);
        while (matcher.find()) {
            if (matcher.start() > 0) {
                cuts.add(matcher.start());
            }
        }
        cuts.add(text.length());

        List<String> segments = new ArrayList<>();
        for (int i = 0; i < cuts.size() - 1; i++) {
            String segment = text.substring(cuts.get(i), cuts.get(i + 1)).strip();
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /**
     * Cuts text into consecutive windows of {@code maxLen} characters (the last may be shorter),
     * trimming each window and dropping blank ones.
     */
    static List<String> hardSplit(String text, int maxLen) {
        List<String> windows = new ArrayList<>();
        for (int start = 0; start < text.length(); start += maxLen) {
            String window = text.substring(start, Math.min(start + maxLen, text.length())).strip();
            if (!window.isEmpty()) {
                windows.add(window);
            }
        }
        return windows;
    }
}

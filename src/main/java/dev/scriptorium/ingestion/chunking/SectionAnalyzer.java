package dev.scriptorium.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Extracts headers and size statistics from chunk text. */
public final class SectionAnalyzer {

    private static final Pattern HEADER = Pattern.compile("^[ \\t]*(#+)[ \\t]+(\\S.*)$", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SectionAnalyzer() {
        // utility class
    }

    /**
     * Analyze a chunk. Headers of every level are reported in order of appearance.
     *
     * @param chunk chunk text; null is treated as empty
     * @return headers, character count and word count
     */
    public static SectionInfo analyze(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return new SectionInfo("", 0, 0);
        }
        List<String> headers = new ArrayList<>();
        Matcher matcher = HEADER.matcher(chunk);
        while (matcher.find()) {
            headers.add(matcher.group(1) + " " + matcher.group(2).strip());
        }
        return new SectionInfo(String.join("; ", headers), chunk.length(), countWords(chunk));
    }

    private static int countWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}

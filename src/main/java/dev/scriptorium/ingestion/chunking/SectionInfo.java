package dev.scriptorium.ingestion.chunking;

/**
 * Structural facts about one chunk.
 *
 * @param headers header lines found in the chunk as {@code "<hashes> <text>"}, joined with
 *     {@code "; "}; empty when the chunk has none
 * @param charCount length of the chunk in characters
 * @param wordCount number of whitespace-delimited tokens
 */
public record SectionInfo(String headers, int charCount, int wordCount) {}

package dev.scriptorium.ingestion.chunking;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata stored alongside a chunk in the vector index. Derived entirely from the {@link Chunk}.
 *
 * @param headers semicolon-joined header lines of the chunk, possibly empty
 * @param charCount chunk length in characters
 * @param wordCount whitespace-delimited tokens in the chunk
 * @param chunkIndex run-wide chunk index
 * @param source URL of the source document
 * @param contentHash SHA-256 of the chunk text
 */
public record ChunkMetadata(
        String headers,
        int charCount,
        int wordCount,
        int chunkIndex,
        String source,
        String contentHash) {
    public ChunkMetadata {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(contentHash, "contentHash must not be null");
    }

    /** Analyzes the chunk text and stamps index and source. */
    public static ChunkMetadata of(Chunk chunk) {
        SectionInfo info = SectionAnalyzer.analyze(chunk.text());
        return new ChunkMetadata(
                info.headers(),
                info.charCount(),
                info.wordCount(),
                chunk.index(),
                chunk.sourceUrl(),
                ContentHasher.sha256(chunk.text()));
    }

    /** Snake_case key/value view written to the vector index. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("headers", headers);
        map.put("char_count", charCount);
        map.put("word_count", wordCount);
        map.put("chunk_index", chunkIndex);
        map.put("source", source);
        map.put("content_hash", contentHash);
        return map;
    }
}

package dev.scriptorium.ingestion;

/**
 * A run stopped because the vector index rejected a write. Carries what was written before the
 * failure; earlier batches stay in the index.
 */
public class IngestionException extends RuntimeException {

    private final IngestionOutcome partialOutcome;

    public IngestionException(String message, IngestionOutcome partialOutcome, Throwable cause) {
        super(message, cause);
        this.partialOutcome = partialOutcome;
    }

    public IngestionOutcome partialOutcome() {
        return partialOutcome;
    }
}

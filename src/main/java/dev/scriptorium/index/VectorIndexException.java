package dev.scriptorium.index;

/** Raised when the vector index cannot be opened, written or queried. */
public class VectorIndexException extends RuntimeException {

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }

    public VectorIndexException(String message) {
        super(message);
    }
}

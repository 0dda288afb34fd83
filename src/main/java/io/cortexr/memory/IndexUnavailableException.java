package io.cortexr.memory;

/**
 * Thrown when the similarity index cannot serve a request, typically because the
 * embedding model failed.
 */
public class IndexUnavailableException extends RuntimeException {

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.portkit.core.generation;

/**
 * Raised by a collaborator backend when it cannot produce a usable response.
 *
 * <p>Recoverable: the porting task records it as an incomplete generation and
 * retries while attempts remain.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

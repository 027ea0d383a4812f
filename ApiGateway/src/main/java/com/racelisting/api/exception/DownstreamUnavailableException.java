package com.racelisting.api.exception;

/**
 * A listing service could not be reached.
 */
public class DownstreamUnavailableException extends RuntimeException {

    public DownstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}

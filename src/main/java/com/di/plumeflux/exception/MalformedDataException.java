package com.di.plumeflux.exception;

/**
 * Unparseable or corrupt content (bad .npy header, undecodable image). Never retried.
 */
public class MalformedDataException extends PipelineException {

    public MalformedDataException(String message) {
        super(message);
    }

    public MalformedDataException(String message, Throwable cause) {
        super(message, cause);
    }
}

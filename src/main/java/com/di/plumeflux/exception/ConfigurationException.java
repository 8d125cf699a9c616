package com.di.plumeflux.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Invalid or missing settings. Fatal at startup; the process exits with {@link #EXIT_CODE}.
 */
public class ConfigurationException extends PipelineException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}

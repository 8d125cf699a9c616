package com.di.plumeflux.aspect;

import com.di.plumeflux.exception.CalibrationFitException;
import com.di.plumeflux.exception.ConfigurationException;
import com.di.plumeflux.exception.FluxInputUnavailableException;
import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.exception.MissingDependencyException;
import com.di.plumeflux.exception.OrphanDataException;
import com.di.plumeflux.exception.TransientIoException;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories for unit event logging and for the orchestrator's retry decision.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) with its {@link Disposition},
 * then add a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    TRANSIENT_IO("Transient I/O error", "File locked, incomplete or temporarily unreadable", Disposition.RETRY),
    MALFORMED_DATA("Malformed data", "Unparseable or corrupt file content", Disposition.FAIL),
    MISSING_DEPENDENCY("Missing dependency", "No covering calibration published yet", Disposition.DEFER),
    CONFIGURATION_ERROR("Configuration error", "Invalid or missing station settings", Disposition.FATAL),
    ORPHAN_DATA("Orphan data", "Surplus file with no pairing partner", Disposition.ARCHIVE),
    FIT_NOT_CONVERGED("Calibration fit error", "DOAS fit did not converge or lacked reference spectra", Disposition.FAIL),
    INPUT_UNAVAILABLE("Flux input unavailable", "Plume geometry or wind data missing", Disposition.FAIL),
    RESOURCE_ERROR("Resource error", "System resource exhaustion", Disposition.FAIL),
    APPLICATION_ERROR("Application error", "General application error", Disposition.FAIL),
    UNKNOWN("Unknown error", "Unclassified or unknown error type", Disposition.FAIL);

    /** What the orchestrator does with a unit whose failure falls in a category. */
    public enum Disposition {
        RETRY, FAIL, DEFER, ARCHIVE, FATAL
    }

    private final String name;
    private final String description;
    private final Disposition disposition;

    ErrorCategory(String name, String description, Disposition disposition) {
        this.name = name;
        this.description = description;
        this.disposition = disposition;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    public boolean isRetryable() {
        return disposition == Disposition.RETRY;
    }

    /** Order matters: first match wins. Resource checks run before the generic I/O check. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof TransientIoException, TRANSIENT_IO);
        MATCHERS.put(t -> t instanceof MalformedDataException, MALFORMED_DATA);
        MATCHERS.put(t -> t instanceof MissingDependencyException, MISSING_DEPENDENCY);
        MATCHERS.put(t -> t instanceof ConfigurationException, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof OrphanDataException, ORPHAN_DATA);
        MATCHERS.put(t -> t instanceof CalibrationFitException, FIT_NOT_CONVERGED);
        MATCHERS.put(t -> t instanceof FluxInputUnavailableException, INPUT_UNAVAILABLE);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isTransientIo, TRANSIENT_IO);
        MATCHERS.put(ErrorCategory::isMalformed, MALFORMED_DATA);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        Throwable t = exception instanceof UncheckedIOException && exception.getCause() != null
                ? exception.getCause()
                : exception;
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(t)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isTransientIo(Throwable t) {
        return t instanceof java.nio.file.FileSystemException
                || t instanceof java.io.EOFException
                || t instanceof java.io.IOException;
    }

    private static boolean isMalformed(Throwable t) {
        return t instanceof NumberFormatException
                || t instanceof java.time.format.DateTimeParseException
                || t instanceof java.nio.BufferUnderflowException
                || t instanceof IllegalArgumentException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || (t instanceof java.io.IOException && messageContains(t, "no space", "disk quota"));
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}

package com.di.plumeflux.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a pipeline method for automatic unit event logging.
 * <p>
 * When a method is annotated with @LogUnitEvent, {@link UnitEventAspect} logs
 * {@code <eventType>_STARTED} before the call, {@code <eventType>_COMPLETED} with the duration after
 * it, and {@code <eventType>_FAILED} with the {@link ErrorCategory} if it throws.
 * The unit key is read from MDC, where the orchestrator puts it before running a job.
 *
 * <pre>
 * {@code
 * @LogUnitEvent(eventType = "DOAS_CALIBRATION", stage = "calibration")
 * public CalibrationArtifact calibrate(ProcessingUnit unit) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogUnitEvent {

    /** Event prefix, e.g. "DOAS_CALIBRATION" gives "DOAS_CALIBRATION_STARTED". */
    String eventType();

    /** Pipeline stage the event belongs to (calibration, emission). */
    String stage() default "";

    /** MDC key holding the unit key. */
    String unitKeyMdc() default "unitKey";
}

package com.di.plumeflux.aspect;

import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.util.UnitEventLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs start, completion and failure events around methods annotated with {@link LogUnitEvent}.
 * Events carry the unit key, member count, duration and, on failure, the error category and its
 * disposition so that log search can tell retried failures from terminal ones.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class UnitEventAspect {

    private final UnitEventLogger eventLogger;

    @Around("@annotation(com.di.plumeflux.aspect.LogUnitEvent)")
    public Object logUnitEvent(ProceedingJoinPoint joinPoint) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        LogUnitEvent annotation = method.getAnnotation(LogUnitEvent.class);
        if (annotation == null) {
            // JDK proxies expose the interface method; the annotation lives on the implementation.
            method = joinPoint.getTarget().getClass().getMethod(method.getName(), method.getParameterTypes());
            annotation = method.getAnnotation(LogUnitEvent.class);
        }

        String eventType = annotation.eventType();
        String unitKey = MDC.get(annotation.unitKeyMdc());
        Map<String, Object> context = extractContext(joinPoint, method);
        long startTime = System.currentTimeMillis();

        eventLogger.logEvent(eventType + "_STARTED", context, unitKey, annotation.stage(), null);
        try {
            Object result = joinPoint.proceed();
            context.put("durationMs", System.currentTimeMillis() - startTime);
            if (result != null) {
                context.put("resultType", result.getClass().getSimpleName());
            }
            eventLogger.logEvent(eventType + "_COMPLETED", context, unitKey, annotation.stage(), null);
            return result;
        } catch (Throwable e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            context.put("durationMs", System.currentTimeMillis() - startTime);
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorCategory", category.name());
            context.put("disposition", category.getDisposition().name());
            eventLogger.logEvent(eventType + "_FAILED", context, unitKey, annotation.stage(), e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(ProceedingJoinPoint joinPoint, Method method) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (Object arg : joinPoint.getArgs()) {
            if (arg instanceof ProcessingUnit) {
                ProcessingUnit unit = (ProcessingUnit) arg;
                context.put("unit", unit.getKey().toString());
                context.put("members", unit.getMembers().size());
            }
        }
        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());
        return context;
    }
}

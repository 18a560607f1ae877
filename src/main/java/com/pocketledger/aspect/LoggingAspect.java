package com.pocketledger.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Method execution logging.
 *
 * - services:     DEBUG entry with masked arguments, INFO exit with timing, WARN when slow
 * - controllers:  INFO request/response line with timing
 * - repositories: DEBUG call/return, WARN on slow queries
 *
 * Failures are logged at WARN with type and message only; the exception
 * handler decides what is an error.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final long SLOW_SERVICE_MS = 1000;
    private static final long SLOW_QUERY_MS = 500;
    private static final int MAX_ARG_LENGTH = 100;
    private static final Pattern SENSITIVE = Pattern.compile("(?i)password|token|secret");

    @Around("execution(* com.pocketledger.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        String method = describe(joinPoint);
        if (log.isDebugEnabled()) {
            log.debug("SERVICE CALL: {}({})", method, formatArguments(joinPoint));
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("SERVICE OK: {} in {} ms", method, executionTime);
            if (executionTime > SLOW_SERVICE_MS) {
                log.warn("SLOW OPERATION: {} took {} ms", method, executionTime);
            }
            return result;
        } catch (Exception e) {
            log.warn("SERVICE FAILED: {} after {} ms - {}: {}", method,
                    System.currentTimeMillis() - startTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Around("execution(* com.pocketledger.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        String method = describe(joinPoint);
        log.info("→ HTTP REQUEST: {}", method);

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("← HTTP RESPONSE: {} completed in {} ms", method, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            log.info("← HTTP ERROR: {} failed after {} ms - {}", method,
                    System.currentTimeMillis() - startTime, e.getClass().getSimpleName());
            throw e;
        }
    }

    @Around("execution(* com.pocketledger.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        String method = describe(joinPoint);
        if (log.isDebugEnabled()) {
            log.debug("DB CALL: {}({})", method, formatArguments(joinPoint));
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            if (executionTime > SLOW_QUERY_MS) {
                log.warn("SLOW QUERY: {} took {} ms", method, executionTime);
            }
            return result;
        } catch (Exception e) {
            log.warn("DB ERROR: {} - {}: {}", method, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private static String describe(ProceedingJoinPoint joinPoint) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        return signature.getDeclaringType().getSimpleName() + "." + signature.getName();
    }

    private static String formatArguments(ProceedingJoinPoint joinPoint) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String[] names = signature.getParameterNames();
        Object[] args = joinPoint.getArgs();
        if (args == null || args.length == 0) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                out.append(", ");
            }
            String name = names != null && i < names.length ? names[i] : "arg" + i;
            out.append(name).append('=').append(formatParameter(name, args[i]));
        }
        return out.toString();
    }

    /**
     * Mask sensitive parameters (by name or content) and truncate long values.
     * Byte arrays are summarized by length.
     */
    static String formatParameter(String name, Object param) {
        if (param == null) {
            return "null";
        }
        if (SENSITIVE.matcher(name).find()) {
            return "[REDACTED]";
        }
        String value = param instanceof byte[] bytes ? "byte[" + bytes.length + "]"
                : param instanceof Object[] array ? Arrays.stream(array).map(String::valueOf)
                        .collect(Collectors.joining(", ", "[", "]"))
                : param.toString();
        if (SENSITIVE.matcher(value).find()) {
            return "[REDACTED]";
        }
        if (value.length() > MAX_ARG_LENGTH) {
            return value.substring(0, MAX_ARG_LENGTH - 3) + "...";
        }
        return value;
    }
}

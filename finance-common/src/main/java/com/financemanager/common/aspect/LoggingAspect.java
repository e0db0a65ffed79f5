package com.financemanager.common.aspect;

import com.financemanager.common.config.MdcKeys;
import com.financemanager.common.error.BusinessException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Method execution logging for the service, controller and repository layers of
 * every finance-manager module.
 *
 * Services log entry with parameters, exit with result and duration. Business rule
 * violations are logged at WARN with their error code; anything else at ERROR.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final long SLOW_SERVICE_MS = 1000;
    private static final long SLOW_QUERY_MS = 500;
    private static final int MAX_VALUE_LENGTH = 100;

    @Around("execution(* com.financemanager..service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        String previousExecutionId = MDC.get(MdcKeys.EXECUTION_ID);
        String executionId = generateExecutionId();
        MDC.put(MdcKeys.EXECUTION_ID, executionId);

        log.info("SERVICE CALL: {}.{}({}) [execution {}]",
                className, methodName, formatArguments(signature, joinPoint.getArgs()), executionId);

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("SERVICE OK: {}.{} → {} in {} ms",
                    className, methodName, formatParameter(result), executionTime);
            if (executionTime > SLOW_SERVICE_MS) {
                log.warn("SLOW OPERATION: {}.{} took {} ms", className, methodName, executionTime);
            }
            return result;

        } catch (BusinessException e) {
            log.warn("SERVICE REJECTED: {}.{} - {}: {}", className, methodName, e.getCode(), e.getMessage());
            throw e;

        } catch (Exception e) {
            log.error("SERVICE FAILED: {}.{} - {}: {}",
                    className, methodName, e.getClass().getSimpleName(), e.getMessage());
            throw e;

        } finally {
            if (previousExecutionId != null) {
                MDC.put(MdcKeys.EXECUTION_ID, previousExecutionId);
            } else {
                MDC.remove(MdcKeys.EXECUTION_ID);
            }
        }
    }

    @Around("execution(* com.financemanager..controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        log.info("→ HTTP REQUEST: {}.{}", className, methodName);
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("← HTTP RESPONSE: {}.{} completed in {} ms",
                    className, methodName, System.currentTimeMillis() - startTime);
            return result;

        } catch (Exception e) {
            log.warn("← HTTP ERROR: {}.{} failed after {} ms - {}: {}",
                    className, methodName, System.currentTimeMillis() - startTime,
                    e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    /**
     * DEBUG only; repositories are chatty.
     */
    @Around("execution(* com.financemanager..repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        if (log.isDebugEnabled()) {
            String params = joinPoint.getArgs() != null ? Arrays.stream(joinPoint.getArgs())
                    .map(this::formatParameter)
                    .collect(Collectors.joining(", ")) : "";
            log.debug("DB CALL: {}.{}({})", className, methodName, params);
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.debug("DB RETURN: {}.{} completed in {} ms", className, methodName, executionTime);
            if (executionTime > SLOW_QUERY_MS) {
                log.warn("SLOW QUERY: {}.{} took {} ms", className, methodName, executionTime);
            }
            return result;

        } catch (Exception e) {
            log.error("DB ERROR: {}.{} - {}: {}", className, methodName, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private String formatArguments(MethodSignature signature, Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        String[] names = signature.getParameterNames();
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            String name = (names != null && i < names.length) ? names[i] : "arg" + i;
            builder.append(name).append('=').append(formatParameter(args[i]));
        }
        return builder.toString();
    }

    /**
     * Collections are summarized by size; long values truncated.
     */
    private String formatParameter(Object param) {
        if (param == null) {
            return "null";
        }
        if (param instanceof Collection<?> collection) {
            return param.getClass().getSimpleName() + "[size=" + collection.size() + "]";
        }
        String value = param.toString();
        if (value.length() > MAX_VALUE_LENGTH) {
            return value.substring(0, MAX_VALUE_LENGTH - 3) + "...";
        }
        return value;
    }

    private String generateExecutionId() {
        return String.format("%d-%d", System.currentTimeMillis(), Thread.currentThread().getId());
    }
}

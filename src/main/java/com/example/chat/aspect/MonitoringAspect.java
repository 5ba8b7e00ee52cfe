package com.example.chat.aspect;

import com.example.chat.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    @Around("execution(public * com.example.chat.service.gateway.ChatGateway.*(..))")
    public Object monitorGateway(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "chat.gateway", "gateway");
    }

    @Around("execution(public * com.example.chat.service.history.HistoryComposer.*(..))")
    public Object monitorHistory(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "chat.history", "history");
    }

    @Around("execution(public * com.example.chat.service.archive.MessageArchiver.*(..))")
    public Object monitorArchiver(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "chat.archive", "archive");
    }

    /**
     * Targets the interface so both cache implementations are covered.
     */
    @Around("execution(* com.example.chat.service.cache.RecentMessageCache.*(..))")
    public Object monitorCache(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "chat.cache", "cache");
    }

    @Around("execution(* com.example.chat.repository.*Repository.*(..))")
    public Object monitorRepository(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "chat.database", "database");
    }

    private Object monitor(ProceedingJoinPoint joinPoint, String metricPrefix, String errorType) throws Throwable {
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = joinPoint.getSignature().getName();
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer(metricPrefix + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter(metricPrefix + ".calls", "class", className, "method", methodName, "status", "success");
            log.debug("{}.{} completed successfully in {}ms", className, methodName, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer(metricPrefix + ".latency", duration, "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter(metricPrefix + ".calls", "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("chat.errors", "type", errorType);
            log.error("{}.{} failed after {}ms: {}", className, methodName, duration, e.getMessage());
            throw e;
        }
    }
}

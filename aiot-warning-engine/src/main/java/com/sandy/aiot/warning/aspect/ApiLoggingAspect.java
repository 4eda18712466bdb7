package com.sandy.aiot.warning.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs every REST call of the warning API: request arguments, outcome and duration.
 * Collection results are summarized by size; telemetry posts can be frequent, so they log at DEBUG.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_JSON = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.aiot.warning.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        boolean quiet = uri.startsWith("/data/api/telemetry");

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.toShortString();
        if (quiet) {
            log.debug("API Request: method={} uri={} handler={} args={}", method, uri, handler, toJson(argMap(sig, pjp.getArgs())));
        } else {
            log.info("API Request: method={} uri={} handler={} args={}", method, uri, handler, toJson(argMap(sig, pjp.getArgs())));
        }
        try {
            Object result = pjp.proceed();
            long cost = System.currentTimeMillis() - start;
            Object body = result instanceof ResponseEntity<?> re ? re.getBody() : result;
            String status = result instanceof ResponseEntity<?> re ? String.valueOf(re.getStatusCode().value()) : "200";
            if (quiet) {
                log.debug("API Response: method={} uri={} status={} durationMs={} result={}", method, uri, status, cost, summarize(body));
            } else {
                log.info("API Response: method={} uri={} status={} durationMs={} result={}", method, uri, status, cost, summarize(body));
            }
            return result;
        } catch (Throwable t) {
            long cost = System.currentTimeMillis() - start;
            log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}",
                    method, uri, handler, cost, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private Map<String, Object> argMap(MethodSignature sig, Object[] args) {
        String[] names = sig.getParameterNames();
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i] instanceof HttpServletRequest) continue;
            map.put(names != null && i < names.length ? names[i] : "arg" + i, args[i]);
        }
        return map;
    }

    private String summarize(Object body) {
        if (body instanceof Collection<?> c) return "[" + c.size() + " items]";
        return toJson(body);
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            return s.length() > MAX_JSON ? s.substring(0, MAX_JSON) + "...(" + (s.length() - MAX_JSON) + " more chars)" : s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}

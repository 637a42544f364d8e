package com.kitchzero.backend.global.error;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes {@link ProblemResponse} bodies from servlet filters and security handlers, which run outside
 * {@link RestExceptionHandler}.
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;

    public ProblemResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, ProblemException problem, String instance) throws IOException {
        if (problem instanceof RetryableProblemException retryable) {
            response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryable.getRetryAfterSeconds()));
        }
        write(response, ProblemResponse.of(problem, instance));
    }

    public void write(HttpServletResponse response, ProblemResponse body) throws IOException {
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}

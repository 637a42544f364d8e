package com.kitchzero.backend.global.security;

import java.io.IOException;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAccessDeniedHandler(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        problemResponseWriter.write(response, new AuthException(AuthErrorCode.FORBIDDEN), request.getRequestURI());
    }
}

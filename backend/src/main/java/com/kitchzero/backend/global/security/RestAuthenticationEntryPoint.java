package com.kitchzero.backend.global.security;

import java.io.IOException;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        problemResponseWriter.write(response, new AuthException(AuthErrorCode.INVALID_TOKEN), request.getRequestURI());
    }
}

package com.kitchzero.backend.global.security;

import java.io.IOException;
import java.util.Set;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.global.error.ProblemResponseWriter;
import com.kitchzero.backend.modules.auth.application.CsrfGuard;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.WebUtils;

/**
 * Rejects state-changing requests whose CSRF cookie and header do not match, before anything else looks at
 * the request body.
 */
@Component
public class CsrfProtectionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CsrfProtectionFilter.class);
    private static final Set<String> PROTECTED_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final CsrfGuard csrfGuard;
    private final ProblemResponseWriter problemResponseWriter;

    public CsrfProtectionFilter(CsrfGuard csrfGuard, ProblemResponseWriter problemResponseWriter) {
        this.csrfGuard = csrfGuard;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Cookie cookie = WebUtils.getCookie(request, CsrfGuard.COOKIE_NAME);
        String cookieValue = cookie != null ? cookie.getValue() : null;
        String headerValue = request.getHeader(CsrfGuard.HEADER_NAME);

        if (!csrfGuard.verify(cookieValue, headerValue)) {
            log.warn("CSRF validation failed for {} {}", request.getMethod(), request.getRequestURI());
            problemResponseWriter.write(response, new AuthException(AuthErrorCode.CSRF_MISMATCH), request.getRequestURI());
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !PROTECTED_METHODS.contains(request.getMethod().toUpperCase());
    }
}

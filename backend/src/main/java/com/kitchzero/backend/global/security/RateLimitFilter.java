package com.kitchzero.backend.global.security;

import java.io.IOException;
import java.time.Clock;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.ProblemResponseWriter;
import com.kitchzero.backend.global.error.RetryableProblemException;
import com.kitchzero.backend.global.web.ClientAddressResolver;
import com.kitchzero.backend.modules.auth.application.InvalidTokenException;
import com.kitchzero.backend.modules.auth.application.JwtTokenService;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.AccessTokenClaims;
import com.kitchzero.backend.modules.auth.domain.UserRole;
import com.kitchzero.backend.modules.ratelimit.application.RateLimitProperties;
import com.kitchzero.backend.modules.ratelimit.application.RateLimitResult;
import com.kitchzero.backend.modules.ratelimit.application.RateLimitService;
import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * First gate of the security chain. Counts the request against the budget of its endpoint class and answers
 * 429 once the budget of the current window is spent.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimitService rateLimitService;
    private final RateLimitProperties rateLimitProperties;
    private final JwtTokenService jwtTokenService;
    private final ProblemResponseWriter problemResponseWriter;
    private final Clock clock;

    public RateLimitFilter(
            RateLimitService rateLimitService,
            RateLimitProperties rateLimitProperties,
            JwtTokenService jwtTokenService,
            ProblemResponseWriter problemResponseWriter,
            Clock clock
    ) {
        this.rateLimitService = rateLimitService;
        this.rateLimitProperties = rateLimitProperties;
        this.jwtTokenService = jwtTokenService;
        this.problemResponseWriter = problemResponseWriter;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        AccessTokenClaims claims = peekAccessToken(request);
        String identity = claims != null
                ? "user:" + claims.userId()
                : "ip:" + ClientAddressResolver.resolve(request);

        EndpointClass endpointClass = classify(request);
        if (claims != null && claims.role() == UserRole.SUPER_ADMIN) {
            endpointClass = endpointClass.adminVariant();
        }

        RateLimitResult result = rateLimitService.checkLimit(identity, rateLimitProperties.policyFor(endpointClass));
        response.setHeader(LIMIT_HEADER, Integer.toString(result.limit()));
        response.setHeader(REMAINING_HEADER, Integer.toString(result.remaining()));
        response.setHeader(RESET_HEADER, Long.toString(result.resetTime().getEpochSecond()));

        if (!result.allowed()) {
            AuthErrorCode code = AuthErrorCode.RATE_LIMITED;
            RetryableProblemException problem = new RetryableProblemException(
                    code.status(), code.publicCode(), code.publicDetail(), result.retryAfterSeconds(clock.instant()));
            problemResponseWriter.write(response, problem, request.getRequestURI());
            return;
        }
        filterChain.doFilter(request, response);
    }

    static EndpointClass classify(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String method = request.getMethod().toUpperCase();
        if ("POST".equals(method) && "/auth/login".equals(path)) {
            return EndpointClass.LOGIN;
        }
        if ("POST".equals(method) && "/auth/refresh".equals(path)) {
            return EndpointClass.REFRESH;
        }
        if (path.startsWith("/analytics")) {
            return EndpointClass.ANALYTICS;
        }
        if (path.startsWith("/export")) {
            return EndpointClass.EXPORT;
        }
        return switch (method) {
            case "GET", "HEAD" -> EndpointClass.API_READ;
            case "DELETE" -> EndpointClass.API_DELETE;
            default -> EndpointClass.API_WRITE;
        };
    }

    // Signature-only check; session liveness is left to the authentication filter.
    private AccessTokenClaims peekAccessToken(HttpServletRequest request) {
        String token = AccessTokenResolver.resolve(request);
        if (token == null) {
            return null;
        }
        try {
            return jwtTokenService.verifyAccessToken(token);
        } catch (InvalidTokenException ex) {
            return null;
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!rateLimitProperties.isEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        return request.getRequestURI().startsWith(request.getContextPath() + "/actuator/health");
    }
}

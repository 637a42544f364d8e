package com.kitchzero.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.kitchzero.backend.modules.auth.application.InvalidTokenException;
import com.kitchzero.backend.modules.auth.application.JwtTokenService;
import com.kitchzero.backend.modules.auth.application.JwtTokenService.AccessTokenClaims;
import com.kitchzero.backend.modules.auth.application.SessionService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates a request from its access token. The token must verify and its session must still be live;
 * otherwise the request continues unauthenticated and the entry point answers 401 where authentication is
 * required.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final JwtTokenService jwtTokenService;
    private final SessionService sessionService;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, SessionService sessionService) {
        this.jwtTokenService = jwtTokenService;
        this.sessionService = sessionService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String token = AccessTokenResolver.resolve(request);
        if (token != null) {
            authenticate(token, request);
        }
        filterChain.doFilter(request, response);
    }

    private void authenticate(String token, HttpServletRequest request) {
        AccessTokenClaims claims;
        try {
            claims = jwtTokenService.verifyAccessToken(token);
        } catch (InvalidTokenException ex) {
            log.debug("Ignoring invalid access token: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
            return;
        }

        if (!sessionService.verifyLive(claims.sessionId())) {
            log.debug("Access token for user {} references dead session {}", claims.userId(), claims.sessionId());
            SecurityContextHolder.clearContext();
            return;
        }
        sessionService.touch(claims.sessionId());

        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(
                claims.userId(),
                claims.username(),
                claims.role(),
                claims.branchId(),
                claims.sessionId()
        );
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + claims.role().name())));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }
}

package com.kitchzero.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.domain.UserRole;
import com.kitchzero.backend.modules.auth.infrastructure.jwt.JwtSigningKeys;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_KIND = "kind";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_BRANCH = "branchId";
    static final String CLAIM_SESSION = "sid";
    static final String KIND_ACCESS = "access";
    static final String KIND_REFRESH = "refresh";

    private final JwtSigningKeys signingKeys;
    private final String issuer;
    private final String audience;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtSigningKeys signingKeys,
            @Value("${app.auth.jwt.issuer}") String issuer,
            @Value("${app.auth.jwt.audience}") String audience,
            @Value("${app.auth.jwt.access-ttl:PT15M}") Duration accessTokenTtl,
            @Value("${app.auth.jwt.refresh-ttl:P7D}") Duration refreshTokenTtl,
            Clock clock
    ) {
        this.signingKeys = signingKeys;
        this.issuer = issuer;
        this.audience = audience;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(AppUser user, UUID sessionId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(accessTokenTtl);

        String token = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(user.getId().toString())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_KIND, KIND_ACCESS)
                .claim(CLAIM_USERNAME, user.getUsername())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_BRANCH, user.getBranchId())
                .claim(CLAIM_SESSION, sessionId.toString())
                .signWith(signingKeys.getAccessKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, toOffset(expiresAt));
    }

    public IssuedRefreshToken issueRefreshToken(UUID userId, UUID sessionId) {
        return issueRefreshToken(userId, sessionId, newTokenId());
    }

    public IssuedRefreshToken issueRefreshToken(UUID userId, UUID sessionId, String tokenId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(refreshTokenTtl);

        String token = Jwts.builder()
                .id(tokenId)
                .subject(userId.toString())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_KIND, KIND_REFRESH)
                .claim(CLAIM_SESSION, sessionId.toString())
                .signWith(signingKeys.getRefreshKey(), SIG.HS256)
                .compact();

        return new IssuedRefreshToken(token, tokenId, toOffset(expiresAt));
    }

    public AccessTokenClaims verifyAccessToken(String token) {
        Claims claims = parse(token, signingKeys.getAccessKey(), KIND_ACCESS);
        try {
            return new AccessTokenClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.get(CLAIM_USERNAME, String.class),
                    UserRole.valueOf(claims.get(CLAIM_ROLE, String.class)),
                    claims.get(CLAIM_BRANCH, String.class),
                    UUID.fromString(claims.get(CLAIM_SESSION, String.class)),
                    toOffset(claims.getIssuedAt().toInstant()),
                    toOffset(claims.getExpiration().toInstant())
            );
        } catch (RuntimeException e) {
            throw new InvalidTokenException("Malformed access token claims", e);
        }
    }

    public RefreshTokenClaims verifyRefreshToken(String token) {
        Claims claims = parse(token, signingKeys.getRefreshKey(), KIND_REFRESH);
        try {
            String tokenId = claims.getId();
            if (tokenId == null || tokenId.isBlank()) {
                throw new InvalidTokenException("Refresh token without id");
            }
            return new RefreshTokenClaims(
                    UUID.fromString(claims.getSubject()),
                    UUID.fromString(claims.get(CLAIM_SESSION, String.class)),
                    tokenId,
                    toOffset(claims.getIssuedAt().toInstant()),
                    toOffset(claims.getExpiration().toInstant())
            );
        } catch (InvalidTokenException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidTokenException("Malformed refresh token claims", e);
        }
    }

    public String newTokenId() {
        return UUID.randomUUID().toString();
    }

    private Claims parse(String token, SecretKey key, String expectedKind) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing token");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .requireAudience(audience)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid " + expectedKind + " token", e);
        }
        if (!expectedKind.equals(claims.get(CLAIM_KIND, String.class))) {
            throw new InvalidTokenException("Unexpected token kind");
        }
        if (claims.getExpiration() == null || claims.getIssuedAt() == null) {
            throw new InvalidTokenException("Token without lifetime");
        }
        return claims;
    }

    private OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, clock.getZone());
    }

    public record IssuedToken(String token, OffsetDateTime expiresAt) {
    }

    public record IssuedRefreshToken(String token, String tokenId, OffsetDateTime expiresAt) {
    }

    public record AccessTokenClaims(
            UUID userId,
            String username,
            UserRole role,
            String branchId,
            UUID sessionId,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public record RefreshTokenClaims(
            UUID userId,
            UUID sessionId,
            String tokenId,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }
}

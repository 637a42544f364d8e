package com.kitchzero.backend.modules.ratelimit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.OptionalInt;

import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Repository;

@Repository
public class RateLimitCounterRepositoryImpl implements RateLimitCounterRepositoryCustom {

    // The WHERE on the conflict branch leaves a full counter untouched and returns no row.
    private static final String UPSERT_SQL = """
            INSERT INTO rate_limit_counter
                (client_identity, endpoint_class, window_start, request_count, expires_at, created_at, updated_at)
            VALUES (:clientIdentity, :endpointClass, :windowStart, 1, :expiresAt, :now, :now)
            ON CONFLICT (client_identity, endpoint_class, window_start)
            DO UPDATE SET request_count = rate_limit_counter.request_count + 1,
                          updated_at = EXCLUDED.updated_at
                    WHERE rate_limit_counter.request_count < :limit
            RETURNING request_count
            """;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public OptionalInt incrementIfBelowLimit(String clientIdentity,
                                             EndpointClass endpointClass,
                                             OffsetDateTime windowStart,
                                             OffsetDateTime expiresAt,
                                             int limit,
                                             OffsetDateTime now) {
        List<?> rows = entityManager.createNativeQuery(UPSERT_SQL)
                .setParameter("clientIdentity", clientIdentity)
                .setParameter("endpointClass", endpointClass.name())
                .setParameter("windowStart", windowStart)
                .setParameter("expiresAt", expiresAt)
                .setParameter("now", now)
                .setParameter("limit", limit)
                .getResultList();
        if (rows.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(((Number) rows.get(0)).intValue());
    }
}

package com.kitchzero.backend.modules.ratelimit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;
import com.kitchzero.backend.modules.ratelimit.domain.RateLimitCounter;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RateLimitCounterRepository
        extends JpaRepository<RateLimitCounter, Long>, RateLimitCounterRepositoryCustom {

    @Query("""
            select c.requestCount
              from RateLimitCounter c
             where c.clientIdentity = :clientIdentity
               and c.endpointClass = :endpointClass
               and c.windowStart = :windowStart
            """)
    Optional<Integer> findRequestCount(@Param("clientIdentity") String clientIdentity,
                                       @Param("endpointClass") EndpointClass endpointClass,
                                       @Param("windowStart") OffsetDateTime windowStart);

    @Modifying
    @Query("delete from RateLimitCounter c where c.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from RateLimitCounter c where c.clientIdentity = :clientIdentity and c.endpointClass = :endpointClass")
    int deleteByKey(@Param("clientIdentity") String clientIdentity,
                    @Param("endpointClass") EndpointClass endpointClass);
}

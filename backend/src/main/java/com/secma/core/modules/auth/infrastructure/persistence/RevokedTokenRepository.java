package com.secma.core.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.secma.core.modules.auth.domain.RevokedToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface RevokedTokenRepository extends JpaRepository<RevokedToken, String> {

    @Transactional
    @Modifying
    @Query("delete from RevokedToken rt where rt.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}

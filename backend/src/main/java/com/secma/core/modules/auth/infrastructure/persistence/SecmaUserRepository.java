package com.secma.core.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.secma.core.modules.auth.domain.SecmaUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SecmaUserRepository extends JpaRepository<SecmaUser, UUID> {

    @Query("""
            select u
              from SecmaUser u
              join fetch u.application a
             where a.id = :applicationId
               and u.login = :login
            """)
    Optional<SecmaUser> findByApplicationAndLogin(@Param("applicationId") UUID applicationId,
                                                  @Param("login") String login);

    @Query("""
            select u
              from SecmaUser u
              join fetch u.application a
             where a.id = :applicationId
               and u.id = :userId
            """)
    Optional<SecmaUser> findInApplication(@Param("applicationId") UUID applicationId,
                                          @Param("userId") UUID userId);

    @Query("""
            select u
              from SecmaUser u
             where u.application.id = :applicationId
             order by u.login
            """)
    List<SecmaUser> findAllInApplication(@Param("applicationId") UUID applicationId);

    boolean existsByApplicationIdAndLogin(UUID applicationId, String login);

    long countByApplicationId(UUID applicationId);

    @Query("""
            select count(u)
              from SecmaUser u
             where not exists (
                    select g.id
                      from RoleGrant g
                     where g.user = u
             )
            """)
    long countWithoutGrants();
}

package com.secma.core.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.secma.core.modules.auth.domain.RoleGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleGrantRepository extends JpaRepository<RoleGrant, UUID> {

    /**
     * Permission strings reachable from the user's grants in one application. Disabled users and
     * disabled applications resolve to nothing.
     */
    @Query("""
            select distinct p
              from RoleGrant g
              join g.role r
              join r.permissions p
              join g.user u
              join g.application a
             where u.id = :userId
               and a.id = :applicationId
               and r.application.id = :applicationId
               and u.enabled = true
               and a.enabled = true
            """)
    List<String> findPermissionsOf(@Param("userId") UUID userId,
                                   @Param("applicationId") UUID applicationId);

    @Query("""
            select r.name
              from RoleGrant g
              join g.role r
             where g.user.id = :userId
               and g.application.id = :applicationId
             order by r.name
            """)
    List<String> findRoleNamesOf(@Param("userId") UUID userId,
                                 @Param("applicationId") UUID applicationId);

    @Query("""
            select g
              from RoleGrant g
              join fetch g.role r
             where g.user.id = :userId
               and g.application.id = :applicationId
             order by r.name
            """)
    List<RoleGrant> findAllOfUser(@Param("userId") UUID userId,
                                  @Param("applicationId") UUID applicationId);

    @Query("""
            select g
              from RoleGrant g
             where g.user.id = :userId
               and g.role.id = :roleId
               and g.application.id = :applicationId
            """)
    Optional<RoleGrant> findGrant(@Param("applicationId") UUID applicationId,
                                  @Param("userId") UUID userId,
                                  @Param("roleId") UUID roleId);

    boolean existsByUserIdAndRoleId(UUID userId, UUID roleId);

    @Modifying
    @Query("delete from RoleGrant g where g.role.id = :roleId")
    int deleteAllOfRole(@Param("roleId") UUID roleId);
}

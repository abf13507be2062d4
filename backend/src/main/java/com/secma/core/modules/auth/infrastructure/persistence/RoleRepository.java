package com.secma.core.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.secma.core.modules.auth.domain.Role;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    @EntityGraph(attributePaths = {"permissions"})
    @Query("""
            select r
              from Role r
             where r.application.id = :applicationId
               and r.id = :roleId
            """)
    Optional<Role> findInApplication(@Param("applicationId") UUID applicationId,
                                     @Param("roleId") UUID roleId);

    @EntityGraph(attributePaths = {"permissions"})
    @Query("""
            select r
              from Role r
             where r.application.id = :applicationId
             order by r.name
            """)
    List<Role> findAllInApplication(@Param("applicationId") UUID applicationId);

    boolean existsByApplicationIdAndName(UUID applicationId, String name);

    long countByApplicationId(UUID applicationId);

    @Query("select count(r) from Role r where r.permissions is empty")
    long countWithoutPermissions();
}

package com.secma.core.modules.tenancy.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.secma.core.modules.tenancy.domain.Application;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ApplicationRepository extends JpaRepository<Application, UUID> {

    Optional<Application> findByName(String name);

    boolean existsByName(String name);

    List<Application> findAllByOrderByNameAsc();

    @Query("""
            select count(a)
              from Application a
             where not exists (
                    select u.id
                      from SecmaUser u
                     where u.application = a
             )
            """)
    long countWithoutUsers();
}

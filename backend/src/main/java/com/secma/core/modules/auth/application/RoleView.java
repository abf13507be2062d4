package com.secma.core.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.secma.core.modules.auth.domain.Role;

public record RoleView(
        UUID id,
        UUID applicationId,
        String name,
        String description,
        List<String> permissions,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RoleView from(Role role) {
        return new RoleView(
                role.getId(),
                role.getApplication().getId(),
                role.getName(),
                role.getDescription(),
                role.getPermissions(),
                role.getCreatedAt(),
                role.getUpdatedAt()
        );
    }
}

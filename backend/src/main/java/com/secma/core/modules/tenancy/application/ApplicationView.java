package com.secma.core.modules.tenancy.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.secma.core.modules.tenancy.domain.Application;

public record ApplicationView(
        UUID id,
        String name,
        String title,
        String description,
        boolean enabled,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ApplicationView from(Application application) {
        return new ApplicationView(
                application.getId(),
                application.getName(),
                application.getTitle(),
                application.getDescription(),
                application.isEnabled(),
                application.getCreatedAt(),
                application.getUpdatedAt()
        );
    }
}

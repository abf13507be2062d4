package com.secma.core.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.secma.core.modules.auth.domain.SecmaUser;

public record UserView(
        UUID id,
        UUID applicationId,
        String login,
        boolean enabled,
        OffsetDateTime createdAt,
        OffsetDateTime disabledAt
) {

    public static UserView from(SecmaUser user) {
        return new UserView(
                user.getId(),
                user.getApplication().getId(),
                user.getLogin(),
                user.isEnabled(),
                user.getCreatedAt(),
                user.getDisabledAt()
        );
    }
}

package com.secma.core.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.secma.core.modules.auth.domain.RoleGrant;

public record GrantView(
        UUID id,
        UUID applicationId,
        UUID userId,
        UUID roleId,
        String roleName,
        OffsetDateTime grantedAt
) {

    public static GrantView from(RoleGrant grant) {
        return new GrantView(
                grant.getId(),
                grant.getApplication().getId(),
                grant.getUser().getId(),
                grant.getRole().getId(),
                grant.getRole().getName(),
                grant.getGrantedAt()
        );
    }
}

package com.secma.core.modules.admin.application;

public record StoreStatistics(
        long applications,
        long applicationsWithoutUsers,
        long users,
        long usersWithoutGrants,
        long roles,
        long rolesWithoutPermissions,
        long grants,
        long revokedTokens
) {
}

package com.secma.core.modules.auth.application;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of permission resolution: either a finite set of permission strings or the unrestricted
 * grant held by the super-user.
 */
public final class GrantedPermissions {

    private static final GrantedPermissions ALL = new GrantedPermissions(true, Set.of());
    private static final GrantedPermissions NONE = new GrantedPermissions(false, Set.of());

    private final boolean unrestricted;
    private final Set<String> permissions;

    private GrantedPermissions(boolean unrestricted, Set<String> permissions) {
        this.unrestricted = unrestricted;
        this.permissions = permissions;
    }

    public static GrantedPermissions all() {
        return ALL;
    }

    public static GrantedPermissions of(Collection<String> permissions) {
        if (permissions == null || permissions.isEmpty()) {
            return NONE;
        }
        return new GrantedPermissions(false, Set.copyOf(new TreeSet<>(permissions)));
    }

    public boolean allows(String permission) {
        return unrestricted || permissions.contains(permission);
    }

    public boolean isUnrestricted() {
        return unrestricted;
    }

    /**
     * The explicit permissions. Empty for the unrestricted grant, check {@link #isUnrestricted()}.
     */
    public Set<String> permissions() {
        return permissions;
    }

    @Override
    public String toString() {
        return unrestricted ? "GrantedPermissions[*]" : "GrantedPermissions" + permissions;
    }
}

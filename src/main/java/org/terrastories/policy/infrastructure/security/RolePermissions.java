package org.terrastories.policy.infrastructure.security;

import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.Permission;
import org.terrastories.policy.domain.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Role to permission matrix.
 *
 * <p>Super admins hold {@link Permission#SYSTEM_ADMIN} only and no community permission.
 */
@Component
public class RolePermissions {

    private static final Set<Permission> CONTENT_READ = EnumSet.of(
        Permission.STORIES_READ,
        Permission.PLACES_READ,
        Permission.SPEAKERS_READ
    );

    private static final Set<Permission> CONTENT_WRITE = EnumSet.of(
        Permission.STORIES_WRITE,
        Permission.PLACES_WRITE,
        Permission.SPEAKERS_WRITE
    );

    private final Map<Role, Set<Permission>> grants;

    public RolePermissions() {
        Map<Role, Set<Permission>> matrix = new EnumMap<>(Role.class);

        matrix.put(Role.VIEWER, freeze(EnumSet.copyOf(CONTENT_READ)));

        Set<Permission> elder = EnumSet.copyOf(CONTENT_READ);
        elder.add(Permission.CULTURAL_READ);
        elder.add(Permission.CULTURAL_VALIDATE);
        matrix.put(Role.ELDER, freeze(elder));

        Set<Permission> editor = EnumSet.copyOf(CONTENT_READ);
        editor.addAll(CONTENT_WRITE);
        matrix.put(Role.EDITOR, freeze(editor));

        Set<Permission> admin = EnumSet.noneOf(Permission.class);
        for (Permission permission : Permission.values()) {
            if (permission.isCommunityPermission()) {
                admin.add(permission);
            }
        }
        matrix.put(Role.ADMIN, freeze(admin));

        matrix.put(Role.SUPER_ADMIN, freeze(EnumSet.of(Permission.SYSTEM_ADMIN)));

        this.grants = Collections.unmodifiableMap(matrix);
    }

    public Set<Permission> permissionsOf(Role role) {
        return grants.get(role);
    }

    public boolean hasPermission(Role role, Permission permission) {
        return grants.get(role).contains(permission);
    }

    private static Set<Permission> freeze(Set<Permission> permissions) {
        return Collections.unmodifiableSet(permissions);
    }
}

package com.campusauth.backend.modules.auth.domain;

import static com.campusauth.backend.modules.auth.domain.Permission.GRADES_READ;
import static com.campusauth.backend.modules.auth.domain.Permission.GRADES_WRITE;
import static com.campusauth.backend.modules.auth.domain.Permission.PROFILE_READ;
import static com.campusauth.backend.modules.auth.domain.Permission.SCHEDULE_READ;
import static com.campusauth.backend.modules.auth.domain.Permission.SCHEDULE_WRITE;
import static com.campusauth.backend.modules.auth.domain.Permission.TOKENS_VERIFY;
import static com.campusauth.backend.modules.auth.domain.Permission.USERS_READ;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

/**
 * Fixed role to permission mapping. Built once and resolved at token issue time, so
 * verification never needs a directory lookup.
 */
@Component
public class RolePermissionTable {

    private final Map<Role, Set<Permission>> permissionsByRole;

    public RolePermissionTable() {
        EnumMap<Role, Set<Permission>> table = new EnumMap<>(Role.class);
        table.put(Role.ADMIN, EnumSet.allOf(Permission.class));
        table.put(Role.TEACHER, EnumSet.of(
                PROFILE_READ, TOKENS_VERIFY, USERS_READ,
                GRADES_READ, GRADES_WRITE, SCHEDULE_READ, SCHEDULE_WRITE));
        table.put(Role.STAFF, EnumSet.of(
                PROFILE_READ, TOKENS_VERIFY, USERS_READ, SCHEDULE_READ, SCHEDULE_WRITE));
        table.put(Role.STUDENT, EnumSet.of(
                PROFILE_READ, TOKENS_VERIFY, GRADES_READ, SCHEDULE_READ));

        for (Role role : Role.values()) {
            if (!table.containsKey(role)) {
                throw new IllegalStateException("No permissions defined for role " + role);
            }
            table.put(role, Collections.unmodifiableSet(table.get(role)));
        }
        this.permissionsByRole = Collections.unmodifiableMap(table);
    }

    public Set<Permission> permissionsFor(Role role) {
        return permissionsByRole.get(role);
    }
}

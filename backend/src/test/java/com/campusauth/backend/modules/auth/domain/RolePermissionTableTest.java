package com.campusauth.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;

import org.junit.jupiter.api.Test;

class RolePermissionTableTest {

    private final RolePermissionTable table = new RolePermissionTable();

    @Test
    void adminHoldsEveryPermission() {
        assertThat(table.permissionsFor(Role.ADMIN)).isEqualTo(EnumSet.allOf(Permission.class));
    }

    @Test
    void studentCannotManageUsersOrWriteGrades() {
        assertThat(table.permissionsFor(Role.STUDENT))
                .containsExactlyInAnyOrder(
                        Permission.PROFILE_READ, Permission.TOKENS_VERIFY,
                        Permission.GRADES_READ, Permission.SCHEDULE_READ);
    }

    @Test
    void teacherAndStaffCanReadUsersButNotMutateThem() {
        for (Role role : new Role[] {Role.TEACHER, Role.STAFF}) {
            assertThat(table.permissionsFor(role))
                    .contains(Permission.USERS_READ)
                    .doesNotContain(Permission.USERS_CREATE, Permission.USERS_UPDATE, Permission.USERS_DELETE);
        }
        assertThat(table.permissionsFor(Role.TEACHER)).contains(Permission.GRADES_WRITE);
        assertThat(table.permissionsFor(Role.STAFF)).doesNotContain(Permission.GRADES_READ);
    }

    @Test
    void everyRoleHasAnEntryAndEntriesAreImmutable() {
        for (Role role : Role.values()) {
            assertThat(table.permissionsFor(role)).isNotEmpty();
        }
        assertThatThrownBy(() -> table.permissionsFor(Role.STUDENT).add(Permission.USERS_DELETE))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void roleAndPermissionCodesRoundTrip() {
        assertThat(Role.fromCode("teacher")).isEqualTo(Role.TEACHER);
        assertThat(Role.ADMIN.code()).isEqualTo("admin");
        assertThat(Permission.fromCode("users:read")).isEqualTo(Permission.USERS_READ);
        assertThatThrownBy(() -> Role.fromCode("root")).isInstanceOf(IllegalArgumentException.class);
    }
}

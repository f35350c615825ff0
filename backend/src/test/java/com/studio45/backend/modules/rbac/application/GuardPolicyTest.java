package com.studio45.backend.modules.rbac.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.studio45.backend.global.error.ErrorKind;
import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.modules.rbac.domain.Permission;
import com.studio45.backend.modules.rbac.domain.Role;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GuardPolicyTest {

    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID OTHER_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");

    @Mock
    private AuthorizationResolver authorizationResolver;

    private GuardPolicy guardPolicy;

    @BeforeEach
    void setUp() {
        guardPolicy = new GuardPolicy(authorizationResolver);
    }

    @Test
    void adminCannotDropOwnAdminRole() {
        when(authorizationResolver.hasRole(ADMIN_ID, "admin")).thenReturn(true);

        assertThatThrownBy(() -> guardPolicy.checkRoleReplacement(ADMIN_ID, ADMIN_ID, List.of("user")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.VALIDATION);
                    assertThat(ex.getReason()).isEqualTo("Cannot remove admin role from yourself");
                });
    }

    @Test
    void adminMayKeepOwnAdminRoleOrDemoteOthers() {
        assertThatCode(() -> guardPolicy.checkRoleReplacement(ADMIN_ID, ADMIN_ID, List.of("admin", "user")))
                .doesNotThrowAnyException();
        assertThatCode(() -> guardPolicy.checkRoleReplacement(ADMIN_ID, OTHER_ID, List.of("user")))
                .doesNotThrowAnyException();
        verifyNoInteractions(authorizationResolver);
    }

    @Test
    void selfDeletionIsRejected() {
        assertThatThrownBy(() -> guardPolicy.checkUserDeletion(ADMIN_ID, ADMIN_ID))
                .isInstanceOf(ProblemException.class)
                .hasMessageContaining("Cannot delete yourself");
        assertThatCode(() -> guardPolicy.checkUserDeletion(ADMIN_ID, OTHER_ID)).doesNotThrowAnyException();
    }

    @Test
    void systemRolesCannotBeDeleted() {
        assertThatThrownBy(() -> guardPolicy.checkRoleDeletion(ADMIN_ID, new Role("admin", null)))
                .isInstanceOf(ProblemException.class)
                .hasMessageContaining("cannot delete system role: admin");
        assertThatThrownBy(() -> guardPolicy.checkRoleDeletion(ADMIN_ID, new Role("user", null)))
                .isInstanceOf(ProblemException.class);
        assertThatCode(() -> guardPolicy.checkRoleDeletion(ADMIN_ID, new Role("premium", null)))
                .doesNotThrowAnyException();
    }

    @Test
    void adminRoleMustKeepAdminAccess() {
        Role admin = new Role("admin", null);
        Permission usersRead = new Permission("users.read", "users", "read", null);
        Permission adminAccess = new Permission("admin.access", "admin", "access", null);

        assertThatThrownBy(() -> guardPolicy.checkRolePermissionReplacement(ADMIN_ID, admin, List.of(usersRead)))
                .isInstanceOf(ProblemException.class)
                .hasMessageContaining("cannot remove admin.access permission from admin role");
        assertThatCode(() -> guardPolicy.checkRolePermissionReplacement(ADMIN_ID, admin, List.of(usersRead, adminAccess)))
                .doesNotThrowAnyException();
        assertThatCode(() -> guardPolicy.checkRolePermissionReplacement(ADMIN_ID, new Role("moderator", null), List.of(usersRead)))
                .doesNotThrowAnyException();
    }

    @Test
    void adminAccessPermissionCannotBeRenamedOrDeleted() {
        Permission adminAccess = new Permission("admin.access", "admin", "access", null);

        assertThatThrownBy(() -> guardPolicy.checkPermissionRename(ADMIN_ID, adminAccess, "admin.panel"))
                .isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> guardPolicy.checkPermissionDeletion(ADMIN_ID, adminAccess))
                .isInstanceOf(ProblemException.class);
        assertThatCode(() -> guardPolicy.checkPermissionRename(ADMIN_ID, adminAccess, "admin.access"))
                .doesNotThrowAnyException();
    }
}

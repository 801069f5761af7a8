package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.exception.AuthenticationException;
import warden.core.exception.AuthorizationException;
import warden.core.exception.PermissionDeniedException;
import warden.core.model.auth.AuthFailureKind;
import warden.core.model.auth.AuthOutcome;
import warden.core.model.auth.RoleCheck;
import warden.core.model.auth.UserPrincipal;

@DisplayName("AuthorizationService")
class AuthorizationServiceTest {

    private final AuthorizationService service = new AuthorizationService();

    private static UserPrincipal principalWith(String... roles) {
        return new UserPrincipal("u1", "alice", 4_102_444_800L, List.of(roles));
    }

    @Nested
    @DisplayName("hasRoles()")
    class HasRolesTests {

        @Test
        @DisplayName("should grant when all required roles are held")
        void shouldGrantSubset() {
            final var result = service.hasRoles(principalWith("admin", "viewer", "reports"), List.of("reports", "admin"));

            assertEquals(RoleCheck.allow(), result);
            assertTrue(result.missing().isEmpty());
        }

        @Test
        @DisplayName("should grant when nothing is required")
        void shouldGrantEmptyRequirement() {
            assertTrue(service.hasRoles(principalWith(), List.of()).granted());
        }

        @Test
        @DisplayName("should list missing roles in request order")
        void shouldListMissingInOrder() {
            final var result = service.hasRoles(principalWith("viewer"), List.of("reports", "viewer", "admin"));

            assertFalse(result.granted());
            assertEquals(List.of("reports", "admin"), result.missing());
        }

        @Test
        @DisplayName("should match roles case-sensitively")
        void shouldMatchCaseSensitively() {
            assertEquals(List.of("Admin"), service.hasRoles(principalWith("admin"), List.of("Admin")).missing());
        }
    }

    @Nested
    @DisplayName("requireRoles()")
    class RequireRolesTests {

        @Test
        @DisplayName("should be forbidden with the missing roles")
        void shouldForbidMissingRoles() {
            final var guard = service.requireRoles("admin", "reports");

            final var error = assertThrows(PermissionDeniedException.class, () -> guard.check(principalWith("admin")));

            assertEquals(List.of("reports"), error.missingRoles());
            assertEquals("Missing required roles: reports", error.getMessage());
            assertInstanceOf(AuthorizationException.class, error);
        }

        @Test
        @DisplayName("should comma-join several missing roles")
        void shouldJoinMissingRoles() {
            final var error = assertThrows(
                    PermissionDeniedException.class, () -> service.requireRoles("a", "b").check(principalWith()));

            assertEquals("Missing required roles: a, b", error.getMessage());
        }

        @Test
        @DisplayName("should pass silently when granted")
        void shouldPassWhenGranted() {
            assertDoesNotThrow(() -> service.requireRoles("admin").check(principalWith("admin")));
            assertDoesNotThrow(
                    () -> service.requireRoles().check(AuthOutcome.authenticated(principalWith())));
        }

        @Test
        @DisplayName("should require authentication without a principal")
        void shouldRequireAuthentication() {
            final var guard = service.requireRoles("admin");

            final var anonymous = assertThrows(AuthenticationException.class, () -> guard.check((UserPrincipal) null));
            assertEquals("Authentication required", anonymous.getMessage());
            assertThrows(AuthenticationException.class, () -> guard.check(AuthOutcome.exempt()));
            assertThrows(
                    AuthenticationException.class,
                    () -> guard.check(AuthOutcome.failed(AuthFailureKind.EXPIRED, "late")));
            assertThrows(AuthenticationException.class, () -> guard.check((AuthOutcome) null));
        }
    }

    @Nested
    @DisplayName("checkPermission()")
    class CheckPermissionTests {

        private final Map<String, List<String>> registry = Map.of("chat", List.of("chatter"), "ops", List.of("admin"));

        @Test
        @DisplayName("should allow handlers whose roles are held")
        void shouldAllowHeldRoles() {
            assertTrue(service.checkPermission(principalWith("chatter"), "chat", registry));
        }

        @Test
        @DisplayName("should deny handlers whose roles are missing")
        void shouldDenyMissingRoles() {
            assertFalse(service.checkPermission(principalWith("chatter"), "ops", registry));
        }

        @Test
        @DisplayName("should allow handlers absent from the registry")
        void shouldAllowUnregisteredHandlers() {
            assertTrue(service.checkPermission(principalWith(), "lobby", registry));
        }
    }
}

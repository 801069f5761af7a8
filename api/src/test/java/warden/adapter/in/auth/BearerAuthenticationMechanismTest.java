package warden.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.quarkus.security.identity.IdentityProviderManager;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.identity.request.AuthenticationRequest;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import warden.core.port.in.AuthenticationUseCase;

@DisplayName("BearerAuthenticationMechanism")
class BearerAuthenticationMechanismTest {

    private AuthenticationUseCase authentication;
    private IdentityProviderManager identityProviderManager;
    private RoutingContext routingContext;
    private HttpServerRequest httpRequest;
    private BearerAuthenticationMechanism mechanism;

    @BeforeEach
    void setUp() {
        authentication = mock(AuthenticationUseCase.class);
        identityProviderManager = mock(IdentityProviderManager.class);
        routingContext = mock(RoutingContext.class);
        httpRequest = mock(HttpServerRequest.class);

        when(routingContext.request()).thenReturn(httpRequest);
        when(httpRequest.path()).thenReturn("/me");

        mechanism = new BearerAuthenticationMechanism(authentication);
    }

    @Nested
    @DisplayName("authenticate")
    class AuthenticateTests {

        @Test
        @DisplayName("should return null identity for excluded paths")
        void shouldSkipExcludedPaths() {
            when(authentication.isExempt(any())).thenReturn(true);

            SecurityIdentity result = mechanism
                    .authenticate(routingContext, identityProviderManager)
                    .await()
                    .indefinitely();

            assertNull(result);
            verify(identityProviderManager, never()).authenticate(any());
        }

        @Test
        @DisplayName("should delegate other requests to the identity provider")
        void shouldDelegateToIdentityProvider() {
            final var identity = mock(SecurityIdentity.class);
            when(authentication.isExempt(any())).thenReturn(false);
            when(identityProviderManager.authenticate(any())).thenReturn(Uni.createFrom().item(identity));

            SecurityIdentity result = mechanism
                    .authenticate(routingContext, identityProviderManager)
                    .await()
                    .indefinitely();

            assertSame(identity, result);
            ArgumentCaptor<AuthenticationRequest> captor = ArgumentCaptor.forClass(AuthenticationRequest.class);
            verify(identityProviderManager).authenticate(captor.capture());
            assertTrue(captor.getValue() instanceof WardenAuthenticationRequest);
            assertEquals("/me", ((WardenAuthenticationRequest) captor.getValue()).getConnection().path());
        }

        @Test
        @DisplayName("should delegate requests without Authorization header")
        void shouldDelegateWithoutHeader() {
            when(authentication.isExempt(any())).thenReturn(false);
            when(httpRequest.getHeader("Authorization")).thenReturn(null);
            when(identityProviderManager.authenticate(any())).thenReturn(Uni.createFrom().nullItem());

            mechanism.authenticate(routingContext, identityProviderManager).await().indefinitely();

            verify(identityProviderManager).authenticate(any());
        }
    }

    @Nested
    @DisplayName("challenge and credential types")
    class ChallengeTests {

        @Test
        @DisplayName("should challenge with 401 and a Bearer realm")
        void shouldChallengeWithBearer() {
            final var challenge = mechanism.getChallenge(routingContext).await().indefinitely();

            assertEquals(401, challenge.status);
            assertEquals("WWW-Authenticate", challenge.headerName);
            assertEquals(BearerAuthenticationMechanism.CHALLENGE, challenge.headerContent);
        }

        @Test
        @DisplayName("should support WardenAuthenticationRequest")
        void shouldSupportRequestType() {
            assertTrue(mechanism.getCredentialTypes().contains(WardenAuthenticationRequest.class));
        }
    }
}

// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Credentials} and {@link AuthMode}.
 */
public class CredentialsTest {

    @Test
    @DisplayName("Service principal fingerprint should be derived from client ID and secret")
    public void servicePrincipal_FingerprintUsesClientIdAndSecret() {
        // Arrange
        Credentials credentials = Credentials.servicePrincipal("tenant", "my-client", "my-secret");

        // Act & Assert
        assertEquals(AuthMode.SERVICE_PRINCIPAL, credentials.getAuthMode());
        assertEquals(CredentialFingerprint.of("my-client", "my-secret"), credentials.getFingerprint());
    }

    @Test
    @DisplayName("Service principal fingerprint should not depend on the tenant")
    public void servicePrincipal_FingerprintIgnoresTenant() {
        // Arrange
        Credentials first = Credentials.servicePrincipal("tenant-a", "client", "secret");
        Credentials second = Credentials.servicePrincipal("tenant-b", "client", "secret");

        // Act & Assert
        assertEquals(first.getFingerprint(), second.getFingerprint());
    }

    @Test
    @DisplayName("All managed identity credentials should share one fingerprint")
    public void managedIdentity_SharesFingerprint() {
        // Act
        CredentialFingerprint fingerprint = Credentials.managedIdentity().getFingerprint();

        // Assert
        assertEquals(Credentials.managedIdentity().getFingerprint(), fingerprint);
        assertEquals("yy+bXKwtPM8hMNFvULgLIJJ17+8=", fingerprint.getValue());
        assertNull(Credentials.managedIdentity().getClientSecret());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" "})
    @DisplayName("servicePrincipal should reject missing values")
    public void servicePrincipal_RejectsMissingValues(String invalid) {
        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> Credentials.servicePrincipal(invalid, "client", "secret"));
        assertThrows(IllegalArgumentException.class, () -> Credentials.servicePrincipal("tenant", invalid, "secret"));
        assertThrows(IllegalArgumentException.class, () -> Credentials.servicePrincipal("tenant", "client", invalid));
    }

    @Test
    @DisplayName("toString should never contain the client secret")
    public void toString_HidesSecret() {
        // Arrange
        Credentials credentials = Credentials.servicePrincipal("tenant", "client", "super-secret-value");

        // Act & Assert
        assertFalse(credentials.toString().contains("super-secret-value"));
        assertTrue(credentials.toString().contains("client"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"none"})
    @DisplayName("fromPodIdentity should select the service principal when no pod identity is set")
    public void fromPodIdentity_SelectsServicePrincipal(String podIdentity) {
        // Act & Assert
        assertEquals(AuthMode.SERVICE_PRINCIPAL, AuthMode.fromPodIdentity(podIdentity));
    }

    @Test
    @DisplayName("fromPodIdentity should select managed identity for 'azure'")
    public void fromPodIdentity_SelectsManagedIdentity() {
        // Act & Assert
        assertEquals(AuthMode.MANAGED_IDENTITY, AuthMode.fromPodIdentity("azure"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"aws-eks", "gcp", "Azure"})
    @DisplayName("fromPodIdentity should reject unsupported providers")
    public void fromPodIdentity_RejectsUnsupported(String podIdentity) {
        // Act & Assert
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> AuthMode.fromPodIdentity(podIdentity));
        assertTrue(exception.getMessage().contains(podIdentity));
    }
}

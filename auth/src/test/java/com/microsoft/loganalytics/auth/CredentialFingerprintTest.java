// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CredentialFingerprint}.
 */
public class CredentialFingerprintTest {

    @Test
    @DisplayName("of should produce the Base64 encoded SHA-1 of the joined pair")
    public void of_ProducesBase64Sha1() {
        // Act
        CredentialFingerprint fingerprint = CredentialFingerprint.of("my-client", "my-secret");

        // Assert
        assertEquals("lFCbC+CDHFmjWM+lL8jrWGOQGOM=", fingerprint.getValue());
    }

    @Test
    @DisplayName("of should be deterministic for identical pairs")
    public void of_IsDeterministic() {
        // Act
        CredentialFingerprint first = CredentialFingerprint.of("client", "secret");
        CredentialFingerprint second = CredentialFingerprint.of("client", "secret");

        // Assert
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    @DisplayName("of should produce different fingerprints for different pairs")
    public void of_DiffersForDifferentPairs() {
        // Act & Assert
        assertNotEquals(CredentialFingerprint.of("client", "secret"), CredentialFingerprint.of("client", "other-secret"));
        assertNotEquals(CredentialFingerprint.of("client", "secret"), CredentialFingerprint.of("other-client", "secret"));
        assertNotEquals(CredentialFingerprint.of("client", "secret"), CredentialFingerprint.of("secret", "client"));
    }

    @Test
    @DisplayName("of should reject null values")
    public void of_RejectsNull() {
        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> CredentialFingerprint.of(null, "secret"));
        assertThrows(IllegalArgumentException.class, () -> CredentialFingerprint.of("client", null));
    }
}

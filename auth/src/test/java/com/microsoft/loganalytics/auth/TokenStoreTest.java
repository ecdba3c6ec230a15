// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TokenStore}.
 */
public class TokenStoreTest {

    private static AuthToken token(String value, long expiresOn) {
        return new AuthToken(value, "Bearer", 3599, 3599, expiresOn, 0, "https://api.loganalytics.io/");
    }

    @Test
    @DisplayName("get should return empty for an unknown fingerprint")
    public void get_ReturnsEmptyWhenMissing() {
        // Arrange
        TokenStore store = new TokenStore();

        // Act
        Optional<AuthToken> result = store.get(CredentialFingerprint.of("client", "secret"));

        // Assert
        assertFalse(result.isPresent());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("put should overwrite the token stored for the same fingerprint")
    public void put_OverwritesExistingEntry() {
        // Arrange
        TokenStore store = new TokenStore();
        CredentialFingerprint fingerprint = CredentialFingerprint.of("client", "secret");
        AuthToken first = token("first", 100);
        AuthToken second = token("second", 200);

        // Act
        store.put(fingerprint, first);
        store.put(fingerprint, second);

        // Assert
        assertSame(second, store.get(fingerprint).orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("Entries for different fingerprints should be independent")
    public void put_KeepsFingerprintsApart() {
        // Arrange
        TokenStore store = new TokenStore();
        AuthToken first = token("first", 100);
        AuthToken second = token("second", 200);

        // Act
        store.put(CredentialFingerprint.of("client-a", "secret"), first);
        store.put(CredentialFingerprint.of("client-b", "secret"), second);

        // Assert
        assertSame(first, store.get(CredentialFingerprint.of("client-a", "secret")).orElseThrow());
        assertSame(second, store.get(CredentialFingerprint.of("client-b", "secret")).orElseThrow());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("Concurrent readers and writers should always observe whole tokens")
    public void concurrentAccess_ObservesWholeTokens() throws Exception {
        // Arrange
        TokenStore store = new TokenStore();
        CredentialFingerprint fingerprint = CredentialFingerprint.of("client", "secret");
        store.put(fingerprint, token("token-0", 0));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // Act
        for (int t = 0; t < 8; t++) {
            boolean writer = t % 2 == 0;
            results.add(executor.submit(() -> {
                start.await();
                for (int i = 1; i <= 1000; i++) {
                    if (writer) {
                        store.put(fingerprint, token("token-" + i, i));
                    } else {
                        AuthToken read = store.get(fingerprint).orElseThrow();
                        if (!read.getAccessToken().equals("token-" + read.getExpiresOn())) {
                            return false;
                        }
                    }
                }
                return true;
            }));
        }
        start.countDown();

        // Assert
        for (Future<Boolean> result : results) {
            assertTrue(result.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();
        assertEquals(1, store.size());
    }
}

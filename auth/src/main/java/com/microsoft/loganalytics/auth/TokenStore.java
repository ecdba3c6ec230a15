// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide cache of the last known token for each set of credentials.
 * <p>
 * One instance is meant to be created by the host and handed to every scaler it builds, so that scalers with
 * identical credentials reuse a single token. Readers run concurrently; a write excludes all readers and other
 * writers. Entries are only ever overwritten, never removed, so the store grows with the number of distinct
 * credentials seen during the lifetime of the process.
 */
public final class TokenStore {
    private final Map<CredentialFingerprint, AuthToken> tokens = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Gets the cached token for a fingerprint.
     *
     * @param fingerprint the credential fingerprint
     * @return the cached token, or an empty {@code Optional} if none has been stored
     */
    public Optional<AuthToken> get(CredentialFingerprint fingerprint) {
        Helpers.throwIfArgumentNull(fingerprint, "fingerprint");
        this.lock.readLock().lock();
        try {
            return Optional.ofNullable(this.tokens.get(fingerprint));
        } finally {
            this.lock.readLock().unlock();
        }
    }

    /**
     * Stores a token, replacing any token previously cached for the same fingerprint.
     *
     * @param fingerprint the credential fingerprint
     * @param token the token to cache
     */
    public void put(CredentialFingerprint fingerprint, AuthToken token) {
        Helpers.throwIfArgumentNull(fingerprint, "fingerprint");
        Helpers.throwIfArgumentNull(token, "token");
        this.lock.writeLock().lock();
        try {
            this.tokens.put(fingerprint, token);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    /**
     * Gets the number of cached tokens.
     *
     * @return the number of distinct fingerprints stored
     */
    int size() {
        this.lock.readLock().lock();
        try {
            return this.tokens.size();
        } finally {
            this.lock.readLock().unlock();
        }
    }
}

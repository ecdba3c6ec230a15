// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Deterministic digest of a credential pair, used as the {@link TokenStore} key so that raw secrets are never kept
 * as map keys or compared directly.
 */
public final class CredentialFingerprint {
    private final String value;

    private CredentialFingerprint(String value) {
        this.value = value;
    }

    /**
     * Computes the fingerprint of a credential pair.
     *
     * @param first the first half of the pair, typically the client ID
     * @param second the second half of the pair, typically the client secret
     * @return the fingerprint, equal for equal inputs
     */
    public static CredentialFingerprint of(String first, String second) {
        Helpers.throwIfArgumentNull(first, "first");
        Helpers.throwIfArgumentNull(second, "second");

        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship SHA-1
            throw new IllegalStateException("SHA-1 is not available on this platform", e);
        }

        byte[] hash = digest.digest((first + "|" + second).getBytes(StandardCharsets.UTF_8));
        return new CredentialFingerprint(Base64.getEncoder().encodeToString(hash));
    }

    /**
     * Gets the Base64 encoded digest.
     *
     * @return the digest text
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return this.value.equals(((CredentialFingerprint) o).value);
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }

    @Override
    public String toString() {
        return this.value;
    }
}

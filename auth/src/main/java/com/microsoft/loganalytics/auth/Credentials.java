// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Identifies which access token to fetch and cache.
 * <p>
 * A service principal is described by its tenant ID, client ID and client secret. A managed identity carries no
 * secret at all; every managed identity credential in a process resolves to the same token. Instances are
 * immutable.
 */
public final class Credentials {
    private final AuthMode authMode;
    private final String tenantId;
    private final String clientId;
    private final String clientSecret;

    private Credentials(AuthMode authMode, String tenantId, String clientId, String clientSecret) {
        this.authMode = authMode;
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    /**
     * Creates service principal credentials.
     *
     * @param tenantId the Azure AD tenant ID
     * @param clientId the application (client) ID
     * @param clientSecret the client secret
     * @return the credentials
     * @throws IllegalArgumentException if any value is {@code null} or blank
     */
    public static Credentials servicePrincipal(String tenantId, String clientId, String clientSecret) {
        return new Credentials(
                AuthMode.SERVICE_PRINCIPAL,
                Helpers.throwIfArgumentNullOrWhiteSpace(tenantId, "tenantId"),
                Helpers.throwIfArgumentNullOrWhiteSpace(clientId, "clientId"),
                Helpers.throwIfArgumentNullOrWhiteSpace(clientSecret, "clientSecret"));
    }

    /**
     * Creates managed identity credentials.
     *
     * @return the credentials
     */
    public static Credentials managedIdentity() {
        return new Credentials(AuthMode.MANAGED_IDENTITY, null, null, null);
    }

    @Nonnull
    public AuthMode getAuthMode() {
        return this.authMode;
    }

    @Nullable
    public String getTenantId() {
        return this.tenantId;
    }

    @Nullable
    public String getClientId() {
        return this.clientId;
    }

    @Nullable
    public String getClientSecret() {
        return this.clientSecret;
    }

    /**
     * Computes the key under which the token for these credentials is cached.
     *
     * @return the fingerprint of the credential pair
     */
    public CredentialFingerprint getFingerprint() {
        switch (this.authMode) {
            case SERVICE_PRINCIPAL:
                return CredentialFingerprint.of(this.clientId, this.clientSecret);
            case MANAGED_IDENTITY:
                return CredentialFingerprint.of(AuthMode.AZURE_POD_IDENTITY, AuthMode.AZURE_POD_IDENTITY);
            default:
                throw new IllegalStateException("Unsupported authentication mode: " + this.authMode);
        }
    }

    @Override
    public String toString() {
        if (this.authMode == AuthMode.MANAGED_IDENTITY) {
            return "Credentials{authMode=MANAGED_IDENTITY}";
        }
        return "Credentials{authMode=SERVICE_PRINCIPAL, tenantId=" + this.tenantId + ", clientId=" + this.clientId + "}";
    }
}

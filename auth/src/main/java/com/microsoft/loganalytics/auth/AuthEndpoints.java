// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

/**
 * Endpoints used to obtain access tokens. The defaults target the Azure public cloud.
 */
public class AuthEndpoints {
    public static final String DEFAULT_AUTHORITY_HOST = "https://login.microsoftonline.com";
    public static final String DEFAULT_MANAGED_IDENTITY_ENDPOINT = "http://169.254.169.254/metadata/identity/oauth2/token";
    public static final String DEFAULT_RESOURCE = "https://api.loganalytics.io/";

    private String authorityHost = DEFAULT_AUTHORITY_HOST;
    private String managedIdentityEndpoint = DEFAULT_MANAGED_IDENTITY_ENDPOINT;
    private String resource = DEFAULT_RESOURCE;

    /**
     * Gets the Azure AD authority host. The tenant ID and {@code /oauth2/token} are appended to it.
     *
     * @return the authority host
     */
    public String getAuthorityHost() {
        return authorityHost;
    }

    /**
     * Sets the Azure AD authority host.
     *
     * @param authorityHost the authority host, for example {@code https://login.microsoftonline.us}
     * @return This options object.
     * @throws IllegalArgumentException if the value isn't an absolute http or https URL
     */
    public AuthEndpoints setAuthorityHost(String authorityHost) {
        this.authorityHost = Helpers.throwIfArgumentNotAbsoluteUrl(authorityHost, "authorityHost");
        return this;
    }

    /**
     * Gets the instance metadata service token endpoint.
     *
     * @return the managed identity endpoint
     */
    public String getManagedIdentityEndpoint() {
        return managedIdentityEndpoint;
    }

    /**
     * Sets the instance metadata service token endpoint.
     *
     * @param managedIdentityEndpoint the managed identity endpoint, without query parameters
     * @return This options object.
     * @throws IllegalArgumentException if the value isn't an absolute http or https URL
     */
    public AuthEndpoints setManagedIdentityEndpoint(String managedIdentityEndpoint) {
        this.managedIdentityEndpoint = Helpers.throwIfArgumentNotAbsoluteUrl(managedIdentityEndpoint, "managedIdentityEndpoint");
        return this;
    }

    /**
     * Gets the resource the tokens are requested for.
     *
     * @return the resource URI
     */
    public String getResource() {
        return resource;
    }

    /**
     * Sets the resource the tokens are requested for.
     *
     * @param resource the resource URI
     * @return This options object.
     */
    public AuthEndpoints setResource(String resource) {
        this.resource = Helpers.throwIfArgumentNullOrWhiteSpace(resource, "resource");
        return this;
    }
}

// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpRequest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Obtains tokens with the OAuth2 client-credentials grant against the tenant's Azure AD token endpoint.
 */
public final class ServicePrincipalAuthProvider extends TokenEndpointAuthProvider {
    private final Credentials credentials;
    private final AuthEndpoints endpoints;

    public ServicePrincipalAuthProvider(Credentials credentials, HttpClient httpClient, AuthEndpoints endpoints) {
        super(httpClient);
        Helpers.throwIfArgumentNull(credentials, "credentials");
        if (credentials.getAuthMode() != AuthMode.SERVICE_PRINCIPAL) {
            throw new IllegalArgumentException("Service principal credentials are required, got " + credentials.getAuthMode());
        }
        this.credentials = credentials;
        this.endpoints = Helpers.throwIfArgumentNull(endpoints, "endpoints");
    }

    @Override
    public AuthMode getAuthMode() {
        return AuthMode.SERVICE_PRINCIPAL;
    }

    @Override
    String getEndpointName() {
        return "Azure Active Directory";
    }

    @Override
    HttpRequest createTokenRequest() {
        String form = "grant_type=client_credentials"
                + "&client_id=" + encode(this.credentials.getClientId())
                + "&client_secret=" + encode(this.credentials.getClientSecret())
                + "&resource=" + encode(this.endpoints.getResource())
                + "&redirect_uri=" + encode("http://");

        return new HttpRequest(HttpMethod.POST, getTokenUrl())
                .setHeader("Content-Type", "application/x-www-form-urlencoded")
                .setBody(form);
    }

    String getTokenUrl() {
        String authorityHost = this.endpoints.getAuthorityHost();
        if (authorityHost.endsWith("/")) {
            authorityHost = authorityHost.substring(0, authorityHost.length() - 1);
        }
        return authorityHost + "/" + this.credentials.getTenantId() + "/oauth2/token";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpRequest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Obtains tokens from the instance metadata service of the host. The call is unauthenticated.
 */
public final class ManagedIdentityAuthProvider extends TokenEndpointAuthProvider {
    static final String API_VERSION = "2018-02-01";

    private final AuthEndpoints endpoints;

    public ManagedIdentityAuthProvider(HttpClient httpClient, AuthEndpoints endpoints) {
        super(httpClient);
        this.endpoints = Helpers.throwIfArgumentNull(endpoints, "endpoints");
    }

    @Override
    public AuthMode getAuthMode() {
        return AuthMode.MANAGED_IDENTITY;
    }

    @Override
    String getEndpointName() {
        return "Azure Instance Metadata service";
    }

    @Override
    HttpRequest createTokenRequest() {
        String url = this.endpoints.getManagedIdentityEndpoint()
                + "?api-version=" + API_VERSION
                + "&resource=" + URLEncoder.encode(this.endpoints.getResource(), StandardCharsets.UTF_8);

        return new HttpRequest(HttpMethod.GET, url)
                .setHeader("Metadata", "true");
    }
}

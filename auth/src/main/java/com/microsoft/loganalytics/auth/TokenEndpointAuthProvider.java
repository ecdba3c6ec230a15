// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Base class for providers that obtain tokens with a single HTTP call returning the Azure AD token JSON document.
 */
abstract class TokenEndpointAuthProvider implements AuthProvider {
    // Static singletons are recommended by the Jackson documentation
    private static final ObjectMapper jsonObjectMapper = JsonMapper.builder().build();

    private final HttpClient httpClient;

    TokenEndpointAuthProvider(HttpClient httpClient) {
        this.httpClient = Helpers.throwIfArgumentNull(httpClient, "httpClient");
    }

    /**
     * Builds the token request for this flow.
     *
     * @return the request to send
     */
    abstract HttpRequest createTokenRequest();

    /**
     * Gets a short name of the called endpoint for error messages.
     *
     * @return the endpoint name
     */
    abstract String getEndpointName();

    @Override
    public final AuthToken fetchToken() {
        HttpExchange exchange;
        try {
            exchange = HttpExchange.send(this.httpClient, createTokenRequest());
        } catch (RuntimeException e) {
            throw new AuthenticationException(
                    String.format("Error getting access token. Error calling %s. Inner Error: %s", getEndpointName(), e.getMessage()),
                    0, null, e);
        }

        int statusCode = exchange.getStatusCode();
        if (statusCode != 200) {
            throw new AuthenticationException(
                    String.format("Error getting access token from %s. HTTP code: %d. Body: %s",
                            getEndpointName(), statusCode, Helpers.truncate(exchange.getBody())),
                    statusCode, exchange.getBody());
        }

        if (exchange.isEmpty()) {
            throw new AuthenticationException(
                    String.format("Error getting access token from %s. Details: empty body. HTTP code: %d", getEndpointName(), statusCode),
                    statusCode, null);
        }

        AuthToken token;
        try {
            token = jsonObjectMapper.readValue(exchange.getBody(), AuthToken.class);
        } catch (JsonProcessingException e) {
            throw new AuthenticationException(
                    String.format("Error getting access token from %s. Details: can't decode response body to JSON. HTTP code: %d. Inner Error: %s",
                            getEndpointName(), statusCode, e.getOriginalMessage()),
                    statusCode, exchange.getBody(), e);
        }

        if (token == null || token.getAccessToken() == null || token.getAccessToken().isEmpty()) {
            throw new AuthenticationException(
                    String.format("Error getting access token from %s. Details: response contains no access_token. HTTP code: %d",
                            getEndpointName(), statusCode),
                    statusCode, exchange.getBody());
        }

        return token;
    }
}

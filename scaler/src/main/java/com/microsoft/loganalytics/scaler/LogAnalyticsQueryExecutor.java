// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.microsoft.loganalytics.auth.AccessTokenCache;
import com.microsoft.loganalytics.auth.AuthToken;
import com.microsoft.loganalytics.auth.HttpExchange;

import java.util.Collections;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a query against a Log Analytics workspace and turns the result into a {@link MetricSample}.
 * <p>
 * If the service rejects the bearer token (HTTP 403, or a body mentioning {@code TokenExpired}), the token is
 * refreshed and the query is sent once more. A second rejection is reported, not retried.
 */
public final class LogAnalyticsQueryExecutor {
    public static final String DEFAULT_QUERY_ENDPOINT = "https://api.loganalytics.io";
    static final String TOKEN_EXPIRED_MARKER = "TokenExpired";

    private static final Logger logger = Logger.getLogger(LogAnalyticsQueryExecutor.class.getPackage().getName());

    // Static singletons are recommended by the Jackson documentation
    private static final ObjectMapper jsonObjectMapper = JsonMapper.builder().build();

    private final AccessTokenCache tokenCache;
    private final HttpClient httpClient;
    private final String queryUrl;
    private final QueryResultValidator validator = new QueryResultValidator();

    /**
     * Creates an executor for one workspace.
     *
     * @param tokenCache the source of bearer tokens
     * @param httpClient the client used to reach the query endpoint
     * @param queryEndpoint the Log Analytics API host, for example {@link #DEFAULT_QUERY_ENDPOINT}
     * @param workspaceId the workspace to query
     * @throws IllegalArgumentException if the endpoint isn't an absolute http or https URL
     */
    public LogAnalyticsQueryExecutor(AccessTokenCache tokenCache, HttpClient httpClient, String queryEndpoint, String workspaceId) {
        this.tokenCache = Helpers.throwIfArgumentNull(tokenCache, "tokenCache");
        this.httpClient = Helpers.throwIfArgumentNull(httpClient, "httpClient");
        Helpers.throwIfArgumentNotAbsoluteUrl(queryEndpoint, "queryEndpoint");
        Helpers.throwIfArgumentNullOrWhiteSpace(workspaceId, "workspaceId");

        String host = queryEndpoint.endsWith("/") ? queryEndpoint.substring(0, queryEndpoint.length() - 1) : queryEndpoint;
        this.queryUrl = host + "/v1/workspaces/" + workspaceId + "/query";
    }

    /**
     * Runs the query and validates its result.
     *
     * @param query the Kusto query text
     * @return the metric value and optional threshold returned by the query
     * @throws com.microsoft.loganalytics.auth.AuthenticationException if no valid token can be obtained
     * @throws QueryException if the query call fails or its body can't be decoded
     * @throws QueryResultValidationException if the result isn't a single non-negative numeric row
     */
    public MetricSample executeQuery(String query) {
        Helpers.throwIfArgumentNullOrWhiteSpace(query, "query");
        String requestBody = createRequestBody(query);

        HttpExchange exchange = send(requestBody, this.tokenCache.getToken());
        if (isTokenRejected(exchange)) {
            logger.log(Level.WARNING, "Log Analytics rejected the access token with HTTP {0}. Refreshing it and retrying once.",
                    exchange.getStatusCode());
            exchange = send(requestBody, this.tokenCache.refreshToken());
        }

        int statusCode = exchange.getStatusCode();
        if (statusCode != 200) {
            throw new QueryException(
                    String.format("Error processing Log Analytics request. HTTP code %d. Body: %s", statusCode, exchange.getBody()),
                    statusCode, exchange.getBody());
        }

        if (exchange.isEmpty()) {
            throw new QueryException(
                    String.format("Error processing Log Analytics request. Details: empty body. HTTP code: %d", statusCode),
                    statusCode, null);
        }

        QueryResponse response;
        try {
            response = jsonObjectMapper.readValue(exchange.getBody(), QueryResponse.class);
        } catch (JsonProcessingException e) {
            throw new QueryException(
                    String.format("Error processing Log Analytics request. Details: can't decode response body to JSON. HTTP code: %d. Inner Error: %s",
                            statusCode, e.getOriginalMessage()),
                    statusCode, exchange.getBody(), e);
        }
        if (response == null) {
            throw new QueryException(
                    String.format("Error processing Log Analytics request. Details: can't decode response body to JSON. HTTP code: %d", statusCode),
                    statusCode, exchange.getBody());
        }

        return this.validator.validate(response, exchange.getBody());
    }

    String getQueryUrl() {
        return this.queryUrl;
    }

    private HttpExchange send(String requestBody, AuthToken token) {
        HttpRequest request = new HttpRequest(HttpMethod.POST, this.queryUrl)
                .setHeader("Content-Type", "application/json")
                .setHeader("Authorization", "Bearer " + token.getAccessToken())
                .setBody(requestBody);

        try {
            return HttpExchange.send(this.httpClient, request);
        } catch (RuntimeException e) {
            throw new QueryException(
                    String.format("Error calling Log Analytics REST api. Inner Error: %s", e.getMessage()), 0, null, e);
        }
    }

    private static boolean isTokenRejected(HttpExchange exchange) {
        return exchange.getStatusCode() == 403 || exchange.getBody().contains(TOKEN_EXPIRED_MARKER);
    }

    private static String createRequestBody(String query) {
        try {
            return jsonObjectMapper.writeValueAsString(Collections.singletonMap("query", query));
        } catch (JsonProcessingException e) {
            throw new QueryException("Can't construct JSON for request to Log Analytics API. Inner Error: " + e.getMessage(), 0, null, e);
        }
    }
}

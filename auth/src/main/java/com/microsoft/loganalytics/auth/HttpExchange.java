// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpRequest;
import com.azure.core.http.HttpResponse;

import javax.annotation.Nonnull;

/**
 * The status code and body of a completed blocking HTTP call.
 */
public final class HttpExchange {
    static final String USER_AGENT = "loganalytics-scaler-java/1.0.0";

    private final int statusCode;
    private final String body;

    private HttpExchange(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body;
    }

    /**
     * Sends a request on the calling thread and reads the whole response body.
     * <p>
     * {@code Cache-Control: no-cache} and the scaler's user agent are added to the request. Transport failures
     * surface as the unchecked exceptions raised by the underlying client.
     *
     * @param httpClient the client to send the request with
     * @param request the request to send
     * @return the status code and body of the response
     * @throws IllegalStateException if the client completed without producing a response
     */
    public static HttpExchange send(HttpClient httpClient, HttpRequest request) {
        request.setHeader("Cache-Control", "no-cache");
        request.setHeader("User-Agent", USER_AGENT);

        HttpResponse response = httpClient.send(request).block();
        if (response == null) {
            throw new IllegalStateException("The HTTP client completed without a response for " + request.getUrl());
        }

        try (HttpResponse r = response) {
            String body = r.getBodyAsString().block();
            return new HttpExchange(r.getStatusCode(), body != null ? body : "");
        }
    }

    public int getStatusCode() {
        return this.statusCode;
    }

    @Nonnull
    public String getBody() {
        return this.body;
    }

    /**
     * Checks whether the response carried no body.
     *
     * @return {@code true} if the body is empty
     */
    public boolean isEmpty() {
        return this.body.isEmpty();
    }
}

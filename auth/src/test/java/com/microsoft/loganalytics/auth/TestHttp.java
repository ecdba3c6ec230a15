// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpRequest;
import com.azure.core.http.HttpResponse;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * HTTP test doubles: a client that records requests and replays queued responses.
 */
final class TestHttp {

    static HttpResponse response(int statusCode, String body) {
        HttpResponse response = mock(HttpResponse.class);
        when(response.getStatusCode()).thenReturn(statusCode);
        when(response.getBodyAsString()).thenReturn(body == null ? Mono.empty() : Mono.just(body));
        return response;
    }

    static String tokenJson(String accessToken, long expiresOn, long notBefore) {
        return "{\"token_type\":\"Bearer\",\"expires_in\":\"3599\",\"ext_expires_in\":\"3599\","
                + "\"expires_on\":\"" + expiresOn + "\",\"not_before\":\"" + notBefore + "\","
                + "\"resource\":\"https://api.loganalytics.io/\",\"access_token\":\"" + accessToken + "\"}";
    }

    static final class RecordingHttpClient implements HttpClient {
        private final Deque<Supplier<Mono<HttpResponse>>> responses = new ArrayDeque<>();
        private final List<HttpRequest> requests = new ArrayList<>();

        RecordingHttpClient respond(int statusCode, String body) {
            this.responses.add(() -> Mono.just(response(statusCode, body)));
            return this;
        }

        RecordingHttpClient fail(RuntimeException error) {
            this.responses.add(() -> Mono.error(error));
            return this;
        }

        @Override
        public Mono<HttpResponse> send(HttpRequest request) {
            this.requests.add(request);
            Supplier<Mono<HttpResponse>> next = this.responses.poll();
            if (next == null) {
                return Mono.error(new IllegalStateException("No response queued for " + request.getUrl()));
            }
            return next.get();
        }

        List<HttpRequest> getRequests() {
            return this.requests;
        }
    }

    private TestHttp() {
    }
}

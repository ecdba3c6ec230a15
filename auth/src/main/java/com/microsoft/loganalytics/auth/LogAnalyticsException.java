// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class for the failures raised while acquiring tokens for, querying, or interpreting results from the
 * Log Analytics service.
 * <p>
 * Each failure carries the HTTP status code of the call that produced it ({@code 0} when no response was received)
 * and a truncated copy of the response body so that it can be diagnosed without repeating the call.
 */
public class LogAnalyticsException extends RuntimeException {
    private final int statusCode;
    private final String responseBody;

    public LogAnalyticsException(String message, int statusCode, @Nullable String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    public LogAnalyticsException(String message, int statusCode, @Nullable String responseBody, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = Helpers.truncate(responseBody);
    }

    /**
     * Gets the HTTP status code of the failed call.
     *
     * @return the status code, or {@code 0} if the call never produced a response
     */
    public int getStatusCode() {
        return this.statusCode;
    }

    /**
     * Gets the (possibly truncated) response body of the failed call.
     *
     * @return the response body, or an empty string if there was none
     */
    @Nonnull
    public String getResponseBody() {
        return this.responseBody;
    }
}

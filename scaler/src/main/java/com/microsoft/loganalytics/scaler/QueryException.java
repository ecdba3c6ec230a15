// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.microsoft.loganalytics.auth.LogAnalyticsException;

import javax.annotation.Nullable;

/**
 * Exception thrown when the Log Analytics query endpoint can't be reached, answers with a status other than 200,
 * or returns a body that is empty or isn't JSON.
 */
public class QueryException extends LogAnalyticsException {
    public QueryException(String message, int statusCode, @Nullable String responseBody) {
        super(message, statusCode, responseBody);
    }

    public QueryException(String message, int statusCode, @Nullable String responseBody, @Nullable Throwable cause) {
        super(message, statusCode, responseBody, cause);
    }
}

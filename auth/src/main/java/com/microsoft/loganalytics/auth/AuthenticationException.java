// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import javax.annotation.Nullable;

/**
 * Exception thrown when an access token can't be obtained from the identity provider, can't be decoded, or only
 * becomes valid too far in the future to wait for.
 */
public class AuthenticationException extends LogAnalyticsException {
    public AuthenticationException(String message) {
        super(message, 0, null);
    }

    public AuthenticationException(String message, int statusCode, @Nullable String responseBody) {
        super(message, statusCode, responseBody);
    }

    public AuthenticationException(String message, int statusCode, @Nullable String responseBody, @Nullable Throwable cause) {
        super(message, statusCode, responseBody, cause);
    }
}

// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.MalformedURLException;
import java.net.URL;

final class Helpers {
    static final int MAX_BODY_LENGTH = 1024;

    static @Nonnull <V> V throwIfArgumentNull(@Nullable V argValue, String argName) {
        if (argValue == null) {
            throw new IllegalArgumentException("The argument '" + argName + "' was null.");
        }

        return argValue;
    }

    static @Nonnull String throwIfArgumentNullOrWhiteSpace(String argValue, String argName) {
        throwIfArgumentNull(argValue, argName);
        if (argValue.trim().length() == 0) {
            throw new IllegalArgumentException("The argument '" + argName + "' was empty or contained only whitespace.");
        }

        return argValue;
    }

    static @Nonnull String throwIfArgumentNotAbsoluteUrl(String argValue, String argName) {
        throwIfArgumentNullOrWhiteSpace(argValue, argName);
        URL url;
        try {
            url = new URL(argValue);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("The argument '" + argName + "' is not a valid URL: " + argValue, e);
        }
        if ((!"http".equals(url.getProtocol()) && !"https".equals(url.getProtocol())) || url.getHost().isEmpty()) {
            throw new IllegalArgumentException("The argument '" + argName + "' must be an absolute http or https URL: " + argValue);
        }

        return argValue;
    }

    static @Nonnull String truncate(@Nullable String body) {
        if (body == null) {
            return "";
        }

        if (body.length() <= MAX_BODY_LENGTH) {
            return body;
        }

        return body.substring(0, MAX_BODY_LENGTH) + "...(truncated)";
    }

    // Cannot be instantiated
    private Helpers() {
    }
}

// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.MalformedURLException;
import java.net.URL;

final class Helpers {

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

    static boolean isNullOrEmpty(@Nullable String value) {
        return value == null || value.isEmpty();
    }

    // Cannot be instantiated
    private Helpers() {
    }
}

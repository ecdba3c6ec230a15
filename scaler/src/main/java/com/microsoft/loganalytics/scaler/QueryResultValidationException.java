// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.microsoft.loganalytics.auth.LogAnalyticsException;

import javax.annotation.Nullable;

/**
 * Exception thrown when a successful query returns a result that doesn't have the shape of a scalar metric.
 * <p>
 * Retrying can't fix these failures, since the same query against the same data returns the same shape.
 * {@link #getReason()} identifies which rule was broken.
 */
public class QueryResultValidationException extends LogAnalyticsException {
    private final Reason reason;

    public QueryResultValidationException(Reason reason, String details, @Nullable String responseBody) {
        super("Error validating Log Analytics request. Details: " + details, 200, responseBody);
        this.reason = reason;
    }

    /**
     * Gets the rule the query result broke.
     *
     * @return the validation failure reason
     */
    public Reason getReason() {
        return this.reason;
    }

    /**
     * The ways a query result can fail validation, in the order the rules are checked.
     */
    public enum Reason {
        NO_TABLES,
        TOO_MANY_TABLES,
        NO_COLUMNS,
        NO_ROWS,
        TOO_MANY_ROWS,
        UNSUPPORTED_VALUE_TYPE,
        VALUE_NOT_NUMERIC,
        NEGATIVE_VALUE,
        MISSING_THRESHOLD,
        UNSUPPORTED_THRESHOLD_TYPE,
        THRESHOLD_NOT_NUMERIC,
        NEGATIVE_THRESHOLD
    }
}

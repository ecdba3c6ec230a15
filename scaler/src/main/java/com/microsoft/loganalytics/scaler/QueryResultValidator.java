// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.fasterxml.jackson.databind.JsonNode;
import com.microsoft.loganalytics.scaler.QueryResultValidationException.Reason;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts a {@link MetricSample} from a query result.
 * <p>
 * The result must be a single table with exactly one row. The first cell of the row is the metric value and the
 * optional second cell is a threshold that overrides the configured one. Both must be declared as {@code real},
 * {@code int} or {@code long}, must actually be encoded as JSON numbers, and must not be negative. Values are
 * truncated toward zero.
 */
public final class QueryResultValidator {
    private static final Set<String> NUMERIC_TYPES = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("real", "int", "long")));

    /**
     * Validates a query result.
     *
     * @param response the decoded response
     * @return the metric value and the threshold, which is {@link MetricSample#NO_THRESHOLD} if the row has a single
     *         cell
     * @throws QueryResultValidationException if the result breaks any of the rules
     */
    public MetricSample validate(QueryResponse response) {
        return validate(response, null);
    }

    /**
     * Validates a query result, quoting the raw body in any failure.
     *
     * @param response the decoded response
     * @param responseBody the body the response was decoded from
     * @return the metric value and the threshold
     * @throws QueryResultValidationException if the result breaks any of the rules
     */
    public MetricSample validate(QueryResponse response, @Nullable String responseBody) {
        Helpers.throwIfArgumentNull(response, "response");

        List<QueryResponse.Table> tables = response.getTables();
        if (tables.isEmpty()) {
            throw new QueryResultValidationException(Reason.NO_TABLES,
                    "there is no results after running your query, the response has no tables", responseBody);
        }
        if (tables.size() > 1) {
            throw new QueryResultValidationException(Reason.TOO_MANY_TABLES,
                    String.format("too many tables in query result: %d, expected: 1", tables.size()), responseBody);
        }

        QueryResponse.Table table = tables.get(0);
        if (table == null || table.getColumns().isEmpty()) {
            throw new QueryResultValidationException(Reason.NO_COLUMNS,
                    "there is no results after running your query, the table has no columns", responseBody);
        }
        if (table.getRows().isEmpty()) {
            throw new QueryResultValidationException(Reason.NO_ROWS,
                    "there is no results after running your query, the table has no rows", responseBody);
        }
        if (table.getRows().size() > 1) {
            throw new QueryResultValidationException(Reason.TOO_MANY_ROWS,
                    String.format("too many rows in query result: %d, expected: 1", table.getRows().size()), responseBody);
        }

        List<JsonNode> row = table.getRows().get(0);
        if (row == null) {
            row = Collections.emptyList();
        }

        long value = 0;
        if (!row.isEmpty()) {
            CellValue cell = CellValue.from(row.get(0));
            if (!cell.isNull()) {
                value = readNonNegative(cell, columnType(table, 0), "metric value", responseBody,
                        Reason.UNSUPPORTED_VALUE_TYPE, Reason.VALUE_NOT_NUMERIC, Reason.NEGATIVE_VALUE);
            }
        }

        long threshold = MetricSample.NO_THRESHOLD;
        if (row.size() > 1) {
            CellValue cell = CellValue.from(row.get(1));
            if (cell.isNull()) {
                throw new QueryResultValidationException(Reason.MISSING_THRESHOLD,
                        "threshold value is empty, check your query", responseBody);
            }
            threshold = readNonNegative(cell, columnType(table, 1), "threshold value", responseBody,
                    Reason.UNSUPPORTED_THRESHOLD_TYPE, Reason.THRESHOLD_NOT_NUMERIC, Reason.NEGATIVE_THRESHOLD);
        }

        return new MetricSample(value, threshold);
    }

    private static long readNonNegative(
            CellValue cell,
            @Nullable String declaredType,
            String description,
            @Nullable String responseBody,
            Reason unsupportedType,
            Reason notNumeric,
            Reason negative) {
        if (declaredType == null || !NUMERIC_TYPES.contains(declaredType)) {
            throw new QueryResultValidationException(unsupportedType,
                    String.format("%s data type should be real, int or long, but received %s", description, declaredType),
                    responseBody);
        }
        if (cell.getKind() != CellValue.Kind.NUMBER) {
            throw new QueryResultValidationException(notNumeric,
                    String.format("can not convert %s '%s' to a number", description, cell), responseBody);
        }

        double number = cell.getNumber();
        if (number < 0) {
            throw new QueryResultValidationException(negative,
                    String.format("%s should be >=0, but received %f", description, number), responseBody);
        }

        // Narrowing conversion truncates toward zero
        return (long) number;
    }

    @Nullable
    private static String columnType(QueryResponse.Table table, int index) {
        if (index >= table.getColumns().size() || table.getColumns().get(index) == null) {
            return null;
        }
        return table.getColumns().get(index).getType();
    }
}

// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.loganalytics.scaler.QueryResultValidationException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link QueryResultValidator}.
 */
public class QueryResultValidatorTest {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final String ONE_REAL_COLUMN = "[{\"name\":\"MetricValue\",\"type\":\"real\"}]";

    private final QueryResultValidator validator = new QueryResultValidator();

    private MetricSample validate(String json) throws Exception {
        return validator.validate(mapper.readValue(json, QueryResponse.class), json);
    }

    private Reason rejectionReason(String json) {
        QueryResultValidationException e = assertThrows(QueryResultValidationException.class, () -> validate(json));
        assertTrue(e.getMessage().startsWith("Error validating Log Analytics request. Details: "));
        assertEquals(200, e.getStatusCode());
        return e.getReason();
    }

    @Test
    @DisplayName("validate should return value and threshold from a single row")
    public void validate_WithValueAndThreshold_ReturnsBoth() throws Exception {
        // Act
        MetricSample sample = validate(TestHttp.valueAndThreshold("12.0", "100.0"));

        // Assert
        assertEquals(new MetricSample(12, 100), sample);
        assertTrue(sample.hasThreshold());
    }

    @Test
    @DisplayName("validate should return the no-threshold sentinel for a single-cell row")
    public void validate_WithSingleCell_ReturnsNoThreshold() throws Exception {
        // Act
        MetricSample sample = validate(TestHttp.singleRow("[{\"name\":\"Count\",\"type\":\"long\"}]", "[5]"));

        // Assert
        assertEquals(5, sample.getValue());
        assertEquals(MetricSample.NO_THRESHOLD, sample.getThreshold());
        assertFalse(sample.hasThreshold());
    }

    @Test
    @DisplayName("validate should truncate fractional values toward zero")
    public void validate_WithFractions_Truncates() throws Exception {
        // Act
        MetricSample sample = validate(TestHttp.valueAndThreshold("12.9", "99.99"));

        // Assert
        assertEquals(new MetricSample(12, 99), sample);
    }

    @Test
    @DisplayName("validate should treat a null value cell as zero")
    public void validate_WithNullValue_ReturnsZero() throws Exception {
        // Act
        MetricSample sample = validate(TestHttp.singleRow(ONE_REAL_COLUMN, "[null]"));

        // Assert
        assertEquals(0, sample.getValue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"real", "int", "long"})
    @DisplayName("validate should accept every numeric column type")
    public void validate_WithNumericColumnType_Succeeds(String type) throws Exception {
        // Arrange
        String json = TestHttp.singleRow("[{\"name\":\"v\",\"type\":\"" + type + "\"}]", "[7]");

        // Act
        MetricSample sample = validate(json);

        // Assert
        assertEquals(7, sample.getValue());
    }

    @Test
    @DisplayName("validate should reject a result without tables")
    public void validate_WithNoTables_Throws() {
        assertEquals(Reason.NO_TABLES, rejectionReason("{\"tables\":[]}"));
    }

    @Test
    @DisplayName("validate should reject a result with two tables")
    public void validate_WithTwoTables_Throws() {
        // Arrange
        String table = "{\"name\":\"t\",\"columns\":" + ONE_REAL_COLUMN + ",\"rows\":[[1.0]]}";

        // Act & Assert
        assertEquals(Reason.TOO_MANY_TABLES, rejectionReason("{\"tables\":[" + table + "," + table + "]}"));
    }

    @Test
    @DisplayName("validate should reject a table without columns")
    public void validate_WithNoColumns_Throws() {
        assertEquals(Reason.NO_COLUMNS, rejectionReason(TestHttp.singleRow("[]", "[1.0]")));
    }

    @Test
    @DisplayName("validate should reject a null table")
    public void validate_WithNullTable_Throws() {
        assertEquals(Reason.NO_COLUMNS, rejectionReason("{\"tables\":[null]}"));
    }

    @Test
    @DisplayName("validate should reject a value whose column entry is null")
    public void validate_WithNullColumnEntry_Throws() {
        assertEquals(Reason.UNSUPPORTED_VALUE_TYPE, rejectionReason(TestHttp.singleRow("[null]", "[1.0]")));
    }

    @Test
    @DisplayName("validate should reject a table without rows")
    public void validate_WithNoRows_Throws() {
        assertEquals(Reason.NO_ROWS,
                rejectionReason("{\"tables\":[{\"name\":\"t\",\"columns\":" + ONE_REAL_COLUMN + ",\"rows\":[]}]}"));
    }

    @Test
    @DisplayName("validate should reject a table with two rows")
    public void validate_WithTwoRows_Throws() {
        assertEquals(Reason.TOO_MANY_ROWS, rejectionReason(TestHttp.singleRow(ONE_REAL_COLUMN, "[1.0],[2.0]")));
    }

    @Test
    @DisplayName("validate should reject a negative value")
    public void validate_WithNegativeValue_Throws() {
        assertEquals(Reason.NEGATIVE_VALUE, rejectionReason(TestHttp.singleRow(ONE_REAL_COLUMN, "[-1.0]")));
    }

    @Test
    @DisplayName("validate should reject a value column of a non-numeric type")
    public void validate_WithStringColumn_Throws() {
        assertEquals(Reason.UNSUPPORTED_VALUE_TYPE,
                rejectionReason(TestHttp.singleRow("[{\"name\":\"v\",\"type\":\"string\"}]", "[\"12\"]")));
    }

    @Test
    @DisplayName("validate should reject a numeric column holding a non-numeric cell")
    public void validate_WithTextInNumericColumn_Throws() {
        assertEquals(Reason.VALUE_NOT_NUMERIC, rejectionReason(TestHttp.singleRow(ONE_REAL_COLUMN, "[\"twelve\"]")));
    }

    @Test
    @DisplayName("validate should reject a null threshold cell")
    public void validate_WithNullThreshold_Throws() {
        assertEquals(Reason.MISSING_THRESHOLD, rejectionReason(TestHttp.valueAndThreshold("1.0", "null")));
    }

    @Test
    @DisplayName("validate should reject a negative threshold")
    public void validate_WithNegativeThreshold_Throws() {
        assertEquals(Reason.NEGATIVE_THRESHOLD, rejectionReason(TestHttp.valueAndThreshold("1.0", "-5.0")));
    }

    @Test
    @DisplayName("validate should reject a threshold column of a non-numeric type")
    public void validate_WithStringThresholdColumn_Throws() {
        // Arrange
        String json = TestHttp.singleRow(
                "[{\"name\":\"v\",\"type\":\"real\"},{\"name\":\"t\",\"type\":\"string\"}]", "[1.0,\"10\"]");

        // Act & Assert
        assertEquals(Reason.UNSUPPORTED_THRESHOLD_TYPE, rejectionReason(json));
    }

    @Test
    @DisplayName("validate should reject a threshold cell that isn't a number")
    public void validate_WithTextThreshold_Throws() {
        assertEquals(Reason.THRESHOLD_NOT_NUMERIC, rejectionReason(TestHttp.valueAndThreshold("1.0", "\"ten\"")));
    }
}

// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The body of a Log Analytics query response. Cells are kept as raw JSON until {@link QueryResultValidator} checks
 * them against the declared column types.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class QueryResponse {
    private final List<Table> tables;

    @JsonCreator
    public QueryResponse(@JsonProperty("tables") List<Table> tables) {
        this.tables = copyOf(tables);
    }

    public List<Table> getTables() {
        return this.tables;
    }

    private static <T> List<T> copyOf(List<T> values) {
        if (values == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * A result table.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Table {
        private final String name;
        private final List<Column> columns;
        private final List<List<JsonNode>> rows;

        @JsonCreator
        public Table(
                @JsonProperty("name") String name,
                @JsonProperty("columns") List<Column> columns,
                @JsonProperty("rows") List<List<JsonNode>> rows) {
            this.name = name;
            this.columns = copyOf(columns);
            this.rows = copyOf(rows);
        }

        public String getName() {
            return this.name;
        }

        public List<Column> getColumns() {
            return this.columns;
        }

        public List<List<JsonNode>> getRows() {
            return this.rows;
        }
    }

    /**
     * A column declaration: its name and the Kusto type of its cells.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Column {
        private final String name;
        private final String type;

        @JsonCreator
        public Column(@JsonProperty("name") String name, @JsonProperty("type") String type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return this.name;
        }

        public String getType() {
            return this.type;
        }
    }
}

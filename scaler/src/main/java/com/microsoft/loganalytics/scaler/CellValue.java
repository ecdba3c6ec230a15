// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;

/**
 * A single cell of a query result, classified by how it was encoded in the response rather than by the column type
 * the service declared for it.
 */
public final class CellValue {
    private static final CellValue NULL = new CellValue(Kind.NULL, 0, "null");

    private final Kind kind;
    private final double number;
    private final String text;

    private CellValue(Kind kind, double number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    /**
     * Classifies a decoded JSON cell.
     *
     * @param node the cell, or {@code null} if the row had no JSON value there
     * @return the classified cell
     */
    public static CellValue from(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isNumber()) {
            return new CellValue(Kind.NUMBER, node.doubleValue(), node.asText());
        }
        return new CellValue(Kind.OTHER, 0, node.toString());
    }

    public Kind getKind() {
        return this.kind;
    }

    public boolean isNull() {
        return this.kind == Kind.NULL;
    }

    /**
     * Gets the numeric value of a {@link Kind#NUMBER} cell.
     *
     * @return the value as a double
     * @throws IllegalStateException if the cell isn't a number
     */
    public double getNumber() {
        if (this.kind != Kind.NUMBER) {
            throw new IllegalStateException("Cell is not a number: " + this.text);
        }
        return this.number;
    }

    @Override
    public String toString() {
        return this.text;
    }

    /**
     * How a cell was encoded.
     */
    public enum Kind {
        NUMBER,
        NULL,
        OTHER
    }
}

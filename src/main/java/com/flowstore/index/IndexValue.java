package com.flowstore.index;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Normalized form of an indexable scalar. Strings and numbers never collide,
 * and numbers compare by value so 37 and 37.0 are the same index entry.
 */
public final class IndexValue {

    private final String normalized;

    private IndexValue(String normalized) {
        this.normalized = normalized;
    }

    /**
     * Normalize a JSON value for indexing.
     *
     * @param node the field value
     * @return the index value, or null if the node is not a string or finite number
     */
    public static IndexValue of(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return new IndexValue("s:" + node.textValue());
        }
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return null;
            }
            BigDecimal decimal = node.decimalValue().stripTrailingZeros();
            return new IndexValue("n:" + decimal.toPlainString());
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return normalized.equals(((IndexValue) o).normalized);
    }

    @Override
    public int hashCode() {
        return normalized.hashCode();
    }

    @Override
    public String toString() {
        return normalized;
    }
}

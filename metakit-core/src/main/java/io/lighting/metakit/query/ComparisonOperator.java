package io.lighting.metakit.query;

import io.lighting.metakit.page.SortDirection;
import java.util.Objects;

public enum ComparisonOperator {
    GREATER_THAN(">"),
    LESS_THAN("<");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Operator that moves past a cursor value: {@code >} for ascending order,
     * {@code <} for descending order.
     */
    public static ComparisonOperator after(SortDirection direction) {
        Objects.requireNonNull(direction, "direction");
        return direction == SortDirection.DESC ? LESS_THAN : GREATER_THAN;
    }
}

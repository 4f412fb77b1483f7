package com.mythos.core.achievement;

import com.mythos.core.model.StateValues;

import java.util.Collection;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Comparison between an observed value and a criterion target.
 * Numbers compare numerically; anything not comparable yields {@code false}.
 */
public enum ComparisonOperator {
    EQ("eq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("in"),
    CONTAINS("contains");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equalsIgnoreCase(symbol) || operator.name().equalsIgnoreCase(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }

    public boolean test(Object current, Object target) {
        if (current == null) {
            return false;
        }
        return switch (this) {
            case EQ -> StateValues.valuesEqual(current, target);
            case GT -> ordered(current, target, c -> c > 0);
            case GTE -> ordered(current, target, c -> c >= 0);
            case LT -> ordered(current, target, c -> c < 0);
            case LTE -> ordered(current, target, c -> c <= 0);
            case IN -> contains(target, current);
            case CONTAINS -> contains(current, target);
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static boolean ordered(Object current, Object target, IntPredicate accept) {
        if (current instanceof Number a && target instanceof Number b) {
            return accept.test(Double.compare(a.doubleValue(), b.doubleValue()));
        }
        if (current instanceof Comparable comparable && target != null && current.getClass() == target.getClass()) {
            return accept.test(comparable.compareTo(target));
        }
        return false;
    }

    private static boolean contains(Object container, Object element) {
        if (container instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> StateValues.valuesEqual(item, element));
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(element);
        }
        if (container instanceof String text && element != null) {
            return text.contains(String.valueOf(element));
        }
        return false;
    }
}

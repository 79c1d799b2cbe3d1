package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * A predicate over one event column that is applied to every step of a funnel. The operator is
 * kept as written so that definitions with an operator this version does not know still load.
 */
public class FunnelFilter {
    private final String field;
    private final String operator;
    private final List<String> values;

    @JsonCreator
    public FunnelFilter(@JsonProperty("field") String field,
                        @JsonProperty("operator") String operator,
                        @JsonProperty("value") Object value) {
        this.field = field;
        this.operator = operator;
        this.values = toValues(value);
    }

    public FunnelFilter(String field, FilterOperator operator, String... values) {
        this(field, operator.value(), values.length == 1 ? values[0] : ImmutableList.copyOf(values));
    }

    private static List<String> toValues(Object value) {
        if (value == null) {
            return ImmutableList.of();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .filter(Objects::nonNull)
                    .map(String::valueOf)
                    .collect(toImmutableList());
        }
        return ImmutableList.of(String.valueOf(value));
    }

    @JsonProperty
    public String getField() {
        return field;
    }

    @JsonProperty("operator")
    public String getOperatorName() {
        return operator;
    }

    @JsonIgnore
    public Optional<FilterOperator> getFilterOperator() {
        return FilterOperator.fromString(operator);
    }

    @JsonProperty("value")
    public Object getValue() {
        return values.size() == 1 ? values.get(0) : values;
    }

    @JsonIgnore
    public List<String> getValues() {
        return values;
    }

    @JsonIgnore
    public Optional<String> getFirstValue() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelFilter)) {
            return false;
        }
        FunnelFilter that = (FunnelFilter) o;
        return Objects.equals(field, that.field) && Objects.equals(operator, that.operator)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, values);
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + values;
    }

    public enum FilterOperator {
        EQUALS("equals"),
        CONTAINS("contains"),
        NOT_EQUALS("not_equals"),
        IN("in"),
        NOT_IN("not_in");

        private final String value;

        FilterOperator(String value) {
            this.value = value;
        }

        public static Optional<FilterOperator> fromString(String operator) {
            if (operator == null) {
                return Optional.empty();
            }
            String normalized = operator.trim().toLowerCase(Locale.ENGLISH);
            for (FilterOperator filterOperator : values()) {
                if (filterOperator.value.equals(normalized)) {
                    return Optional.of(filterOperator);
                }
            }
            return Optional.empty();
        }

        public String value() {
            return value;
        }
    }
}

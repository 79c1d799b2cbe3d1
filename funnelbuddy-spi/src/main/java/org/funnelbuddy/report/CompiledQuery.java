package org.funnelbuddy.report;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * SQL text with positional {@code ?} placeholders and the values bound to them, in order.
 */
public class CompiledQuery {
    private final String sql;
    private final List<Object> parameters;

    public CompiledQuery(String sql, List<Object> parameters) {
        this.sql = requireNonNull(sql, "sql is null");
        this.parameters = ImmutableList.copyOf(requireNonNull(parameters, "parameters is null"));
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompiledQuery)) {
            return false;
        }
        CompiledQuery that = (CompiledQuery) o;
        return sql.equals(that.sql) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}

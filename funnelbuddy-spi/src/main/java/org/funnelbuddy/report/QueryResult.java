package org.funnelbuddy.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import org.funnelbuddy.collection.SchemaField;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public class QueryResult {
    public static final String EXECUTION_TIME = "executionTimeInMillis";
    public static final String QUERY = "query";
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final List<SchemaField> metadata;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final List<List<Object>> result;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final QueryError error;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Map<String, Object> properties;

    @JsonCreator
    private QueryResult(
            @JsonProperty("metadata") List<SchemaField> metadata,
            @JsonProperty("result") List<List<Object>> result,
            @JsonProperty("error") QueryError error,
            @JsonProperty("properties") Map<String, Object> properties) {
        this.metadata = metadata;
        this.result = result;
        this.error = error;
        this.properties = properties;
    }

    public QueryResult(List<SchemaField> metadata, List<List<Object>> result) {
        this(metadata, result, null, null);
    }

    public QueryResult(List<SchemaField> metadata, List<List<Object>> result, Map<String, Object> properties) {
        this(metadata, result, null, properties);
    }

    public static QueryResult errorResult(QueryError error, String query) {
        return new QueryResult(null, null, error, ImmutableMap.of(QUERY, query));
    }

    @JsonProperty
    public QueryError getError() {
        return error;
    }

    @JsonProperty
    public Map<String, Object> getProperties() {
        return properties == null ? ImmutableMap.of() : properties;
    }

    public boolean isFailed() {
        return error != null;
    }

    @JsonProperty
    public List<List<Object>> getResult() {
        return result;
    }

    @JsonProperty
    public List<SchemaField> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "QueryResult{" +
                (error == null ? "" : "error=" + error) +
                ", result=" + (result == null ? "" : Joiner.on(", ").join(result)) +
                ", metadata=" + (metadata == null ? "" : metadata) +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryResult)) {
            return false;
        }

        QueryResult that = (QueryResult) o;
        return Objects.equals(error, that.error)
                && Objects.equals(metadata, that.metadata)
                && Objects.equals(properties, that.properties)
                && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, result, error, properties);
    }
}

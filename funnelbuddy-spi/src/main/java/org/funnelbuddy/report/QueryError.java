package org.funnelbuddy.report;


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class QueryError {
    public final String message;
    public final String sqlState;
    public final Integer errorCode;

    @JsonCreator
    public QueryError(
            @JsonProperty("message") String message,
            @JsonProperty("sqlState") String sqlState,
            @JsonProperty("errorCode") Integer errorCode) {
        this.message = message;
        this.sqlState = sqlState;
        this.errorCode = errorCode;
    }

    public static QueryError create(String message) {
        return new QueryError(message, null, null);
    }

    @Override
    public String toString() {
        return "QueryError{" +
                "message='" + message + '\'' +
                ", sqlState='" + sqlState + '\'' +
                ", errorCode=" + errorCode +
                '}';
    }
}

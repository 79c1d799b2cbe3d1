package org.funnelbuddy.util;

import io.airlift.log.Logger;
import org.funnelbuddy.report.QueryError;

public class LogUtil {
    private LogUtil() {
    }

    public static void logQueryError(String query, QueryError error, Class<?> source) {
        Logger.get(source).error("Query failed: %s (sqlState=%s, errorCode=%s)\n%s",
                error.message, error.sqlState, error.errorCode, query);
    }

    public static void logQueryError(String query, Throwable e, Class<?> source) {
        Logger.get(source).error(e, "Query failed:\n%s", query);
    }
}

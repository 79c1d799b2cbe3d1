package org.funnelbuddy.util;

import org.funnelbuddy.report.QueryError;

import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;

/**
 * Raised when the event store fails to execute a compiled query. The message is the
 * generic one shown to callers; the failing query is only written to the log.
 */
public class QueryFailedException
        extends FunnelBuddyException {
    private final QueryError error;

    public QueryFailedException(String message, QueryError error) {
        super(message, INTERNAL_SERVER_ERROR);
        this.error = error;
    }

    public QueryError getError() {
        return error;
    }
}

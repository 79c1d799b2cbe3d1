package org.funnelbuddy.util;

import io.netty.handler.codec.http.HttpResponseStatus;

public class FunnelBuddyException
        extends RuntimeException {
    private final HttpResponseStatus statusCode;

    public FunnelBuddyException(String message, HttpResponseStatus statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FunnelBuddyException(HttpResponseStatus statusCode) {
        this(statusCode.reasonPhrase(), statusCode);
    }

    public FunnelBuddyException(String message, HttpResponseStatus statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public HttpResponseStatus getStatusCode() {
        return statusCode;
    }
}

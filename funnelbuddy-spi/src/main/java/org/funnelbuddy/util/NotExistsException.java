package org.funnelbuddy.util;


import io.netty.handler.codec.http.HttpResponseStatus;

public class NotExistsException extends FunnelBuddyException {
    public NotExistsException(String itemName) {
        super(String.format("%s does not exist", itemName), HttpResponseStatus.NOT_FOUND);
    }
}

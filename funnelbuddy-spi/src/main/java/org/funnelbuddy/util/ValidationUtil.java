package org.funnelbuddy.util;

import io.netty.handler.codec.http.HttpResponseStatus;

import javax.annotation.Nullable;

import java.util.Collection;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

public final class ValidationUtil {
    private ValidationUtil()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static String checkWebsiteId(String websiteId) {
        checkArgument(websiteId != null, "websiteId is null");
        checkArgument(!websiteId.trim().isEmpty(), "websiteId is empty");
        return websiteId;
    }

    public static <T> T checkNotNull(T value, String name) {
        checkArgument(value != null, name + " is null");
        return value;
    }

    public static String checkTableColumn(String column, char escape) {
        return checkTableColumn(column, column, escape);
    }

    public static String checkTableColumn(String column, String type, char escape) {
        if (column == null) {
            throw new IllegalArgumentException(type + " is null");
        }

        return escape + stripName(column, "field name") + escape;
    }

    public static String checkTable(String table, char escape) {
        checkArgument(table != null, "table is null");
        StringBuilder builder = new StringBuilder();
        for (String part : table.split("\\.")) {
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(checkTableColumn(part, "table name", escape));
        }
        return builder.toString();
    }

    public static boolean isAllowedColumn(String column, Collection<String> allowedColumns) {
        return column != null && allowedColumns.contains(column);
    }

    public static void checkArgument(boolean expression, @Nullable String errorMessage) {
        if (!expression) {
            if (errorMessage == null) {
                throw new FunnelBuddyException(BAD_REQUEST);
            } else {
                throw new FunnelBuddyException(errorMessage, BAD_REQUEST);
            }
        }
    }

    public static String stripName(String name, String type) {
        if (name.isEmpty()) {
            throw new FunnelBuddyException(type + " is empty", HttpResponseStatus.BAD_REQUEST);
        }

        StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char charAt = name.charAt(i);
            if (charAt == '"' || charAt == '`' || (i == 0 && charAt == ' ')) {
                continue;
            }

            builder.append(charAt);
        }

        if (builder.length() == 0) {
            throw new FunnelBuddyException("Invalid " + type + ": " + name, HttpResponseStatus.BAD_REQUEST);
        }

        int lastIdx = builder.length() - 1;
        if (builder.charAt(lastIdx) == ' ') {
            builder.deleteCharAt(lastIdx);
        }

        return builder.toString();
    }
}

package org.funnelbuddy.collection;

import com.fasterxml.jackson.annotation.JsonCreator;


public enum FieldType {
    STRING, INTEGER, DECIMAL, DOUBLE, LONG, BOOLEAN, DATE, TIME, TIMESTAMP;

    @JsonCreator
    public static FieldType fromString(String key) {
        return key == null ? null : FieldType.valueOf(key.toUpperCase());
    }
}

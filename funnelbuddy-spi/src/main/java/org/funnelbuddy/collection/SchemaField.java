package org.funnelbuddy.collection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.funnelbuddy.util.ValidationUtil;

import static org.funnelbuddy.util.ValidationUtil.stripName;

public class SchemaField {
    private final String name;
    private final FieldType type;

    @JsonCreator
    public SchemaField(@JsonProperty("name") String name,
                       @JsonProperty("type") FieldType type) {
        this.name = stripName(ValidationUtil.checkNotNull(name, "name"), "field name");
        this.type = ValidationUtil.checkNotNull(type, "type");
    }

    @JsonProperty
    public String getName() {
        return name;
    }

    @JsonProperty
    public FieldType getType() {
        return type;
    }

    @Override
    public String toString() {
        return "SchemaField{" +
                "name='" + name + '\'' +
                ", type=" + type +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaField)) {
            return false;
        }

        SchemaField that = (SchemaField) o;

        if (!name.equals(that.name)) {
            return false;
        }
        return type == that.type;
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + type.hashCode();
        return result;
    }
}

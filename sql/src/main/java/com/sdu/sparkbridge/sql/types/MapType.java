package com.sdu.sparkbridge.sql.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 键不允许为null, 值是否可为null由valueContainsNull决定
 *
 * @author hanhan.zhang
 * */
public class MapType extends DataType {

    static final String TYPE_NAME = "map";

    private final DataType keyType;

    private final DataType valueType;

    private final boolean valueContainsNull;

    public MapType(DataType keyType, DataType valueType, boolean valueContainsNull) {
        this.keyType = checkNotNull(keyType, "keyType");
        this.valueType = checkNotNull(valueType, "valueType");
        this.valueContainsNull = valueContainsNull;
    }

    public DataType getKeyType() {
        return keyType;
    }

    public DataType getValueType() {
        return valueType;
    }

    public boolean valueContainsNull() {
        return valueContainsNull;
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    @Override
    public String simpleString() {
        return String.format("map<%s,%s>", keyType.simpleString(), valueType.simpleString());
    }

    @Override
    public JsonNode jsonValue() {
        ObjectNode node = NODES.objectNode();
        node.set("keyType", keyType.jsonValue());
        node.put("type", TYPE_NAME);
        node.put("valueContainsNull", valueContainsNull);
        node.set("valueType", valueType.jsonValue());
        return node;
    }

    static MapType fromJsonValue(JsonNode node) {
        return new MapType(parseDataType(requiredField(node, "keyType")),
                           parseDataType(requiredField(node, "valueType")),
                           requiredBoolean(node, "valueContainsNull"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MapType that = (MapType) o;
        return valueContainsNull == that.valueContainsNull &&
                keyType.equals(that.keyType) &&
                valueType.equals(that.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyType, valueType, valueContainsNull);
    }
}

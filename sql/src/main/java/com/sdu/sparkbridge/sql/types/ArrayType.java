package com.sdu.sparkbridge.sql.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * @author hanhan.zhang
 * */
public class ArrayType extends DataType {

    static final String TYPE_NAME = "array";

    private final DataType elementType;

    private final boolean containsNull;

    public ArrayType(DataType elementType, boolean containsNull) {
        this.elementType = checkNotNull(elementType, "elementType");
        this.containsNull = containsNull;
    }

    public DataType getElementType() {
        return elementType;
    }

    public boolean containsNull() {
        return containsNull;
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    @Override
    public String simpleString() {
        return String.format("array<%s>", elementType.simpleString());
    }

    @Override
    public JsonNode jsonValue() {
        ObjectNode node = NODES.objectNode();
        node.put("containsNull", containsNull);
        node.set("elementType", elementType.jsonValue());
        node.put("type", TYPE_NAME);
        return node;
    }

    static ArrayType fromJsonValue(JsonNode node) {
        return new ArrayType(parseDataType(requiredField(node, "elementType")),
                             requiredBoolean(node, "containsNull"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArrayType that = (ArrayType) o;
        return containsNull == that.containsNull && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, containsNull);
    }
}

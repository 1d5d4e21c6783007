package com.sdu.sparkbridge.sql.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 结构体字段, metadata为任意JSON对象
 *
 * @author hanhan.zhang
 * */
public class StructField {

    private final String name;

    private final DataType dataType;

    private final boolean nullable;

    private final ObjectNode metadata;

    public StructField(String name, DataType dataType, boolean nullable) {
        this(name, dataType, nullable, DataType.NODES.objectNode());
    }

    public StructField(String name, DataType dataType, boolean nullable, ObjectNode metadata) {
        checkArgument(name != null && !name.isEmpty(), "struct field name must not be empty");
        this.name = name;
        this.dataType = checkNotNull(dataType, "dataType");
        this.nullable = nullable;
        this.metadata = checkNotNull(metadata, "metadata").deepCopy();
    }

    public String getName() {
        return name;
    }

    public DataType getDataType() {
        return dataType;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * @return metadata副本
     * */
    public ObjectNode getMetadata() {
        return metadata.deepCopy();
    }

    public String simpleString() {
        return name + ":" + dataType.simpleString();
    }

    JsonNode jsonValue() {
        ObjectNode node = DataType.NODES.objectNode();
        node.set("metadata", metadata.deepCopy());
        node.put("name", name);
        node.put("nullable", nullable);
        node.set("type", dataType.jsonValue());
        return node;
    }

    static StructField fromJsonValue(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Could not parse struct field: " + node);
        }
        JsonNode metadata = node.get("metadata");
        if (metadata != null && !metadata.isNull() && !metadata.isObject()) {
            throw new IllegalArgumentException("struct field metadata must be an object: " + node);
        }
        return new StructField(DataType.requiredField(node, "name").asText(),
                               DataType.parseDataType(DataType.requiredField(node, "type")),
                               DataType.requiredBoolean(node, "nullable"),
                               metadata == null || metadata.isNull() ? DataType.NODES.objectNode() : (ObjectNode) metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructField that = (StructField) o;
        return nullable == that.nullable &&
                name.equals(that.name) &&
                dataType.equals(that.dataType) &&
                metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, nullable, metadata);
    }

    @Override
    public String toString() {
        return String.format("StructField(%s,%s,%s)", name, dataType.simpleString(), nullable);
    }
}

package com.sdu.sparkbridge.sql.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 结构体, 字段有序
 *
 * @author hanhan.zhang
 * */
public class StructType extends DataType {

    static final String TYPE_NAME = "struct";

    private final List<StructField> fields;

    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    public StructType(List<StructField> fields) {
        this.fields = ImmutableList.copyOf(fields);
    }

    public List<StructField> getFields() {
        return fields;
    }

    public List<String> fieldNames() {
        return fields.stream().map(StructField::getName).collect(Collectors.toList());
    }

    /**
     * @return 不存在返回null
     * */
    public StructField getField(String name) {
        for (StructField field : fields) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    /**
     * 追加字段, 返回新的StructType
     * */
    public StructType add(StructField field) {
        return new StructType(ImmutableList.<StructField>builder().addAll(fields).add(field).build());
    }

    public StructType add(String name, DataType dataType, boolean nullable) {
        return add(new StructField(name, dataType, nullable));
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    @Override
    public String simpleString() {
        return fields.stream()
                     .map(StructField::simpleString)
                     .collect(Collectors.joining(",", "struct<", ">"));
    }

    @Override
    public JsonNode jsonValue() {
        ObjectNode node = NODES.objectNode();
        ArrayNode fieldNodes = node.putArray("fields");
        fields.forEach(field -> fieldNodes.add(field.jsonValue()));
        node.put("type", TYPE_NAME);
        return node;
    }

    static StructType fromJsonValue(JsonNode node) {
        JsonNode fieldNodes = requiredField(node, "fields");
        if (!fieldNodes.isArray()) {
            throw new IllegalArgumentException("struct fields must be an array: " + node);
        }
        ImmutableList.Builder<StructField> fields = ImmutableList.builder();
        for (JsonNode fieldNode : fieldNodes) {
            fields.add(StructField.fromJsonValue(fieldNode));
        }
        return new StructType(fields.build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((StructType) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }
}

package com.sdu.sparkbridge.sql.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 数据类型树, 构造后不可变
 *
 * JSON编码:
 *
 * 1: 原子类型为类型名字符串, 如"integer", "decimal(10,2)"
 *
 * 2: 复合类型为带"type"标识的对象, 如{"containsNull":true,"elementType":"string","type":"array"}
 *
 * 3: 对象属性按名称排序输出, 无多余空白
 *
 * @author hanhan.zhang
 * */
public abstract class DataType {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Pattern FIXED_DECIMAL = Pattern.compile("decimal\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");

    /**
     * JSON中的类型标识
     * */
    public abstract String typeName();

    /**
     * 可读形式, 如struct<a:int,b:array<string>>
     * */
    public String simpleString() {
        return typeName();
    }

    public abstract JsonNode jsonValue();

    public String json() {
        try {
            // 经Map输出以按键排序
            return MAPPER.writeValueAsString(MAPPER.treeToValue(jsonValue(), Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to write data type " + simpleString(), e);
        }
    }

    public static DataType fromJson(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed data type json: " + json, e);
        }
        if (node == null || node.isMissingNode()) {
            throw new IllegalArgumentException("Empty data type json");
        }
        return parseDataType(node);
    }

    static DataType parseDataType(JsonNode node) {
        if (node.isTextual()) {
            return parseAtomicType(node.asText());
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Could not parse data type: " + node);
        }
        String type = requiredField(node, "type").asText();
        switch (type) {
            case ArrayType.TYPE_NAME:
                return ArrayType.fromJsonValue(node);
            case MapType.TYPE_NAME:
                return MapType.fromJsonValue(node);
            case StructType.TYPE_NAME:
                return StructType.fromJsonValue(node);
            default:
                throw new IllegalArgumentException("Could not parse data type: " + type);
        }
    }

    private static DataType parseAtomicType(String name) {
        AtomicType atomicType = DataTypes.atomicType(name);
        if (atomicType != null) {
            return atomicType;
        }
        if (DecimalType.TYPE_NAME.equals(name)) {
            return DecimalType.USER_DEFAULT;
        }
        Matcher matcher = FIXED_DECIMAL.matcher(name);
        if (matcher.matches()) {
            return new DecimalType(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        }
        throw new IllegalArgumentException("Could not parse data type: " + name);
    }

    static JsonNode requiredField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException(String.format("Missing '%s' in data type json: %s", field, node));
        }
        return value;
    }

    static boolean requiredBoolean(JsonNode node, String field) {
        JsonNode value = requiredField(node, field);
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(String.format("'%s' must be a boolean in data type json: %s", field, node));
        }
        return value.booleanValue();
    }

    @Override
    public String toString() {
        return simpleString();
    }
}

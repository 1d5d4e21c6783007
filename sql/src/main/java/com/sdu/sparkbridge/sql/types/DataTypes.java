package com.sdu.sparkbridge.sql.types;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * @author hanhan.zhang
 * */
public class DataTypes {

    public static final AtomicType NullType = new AtomicType("null", "null");
    public static final AtomicType StringType = new AtomicType("string", "string");
    public static final AtomicType BinaryType = new AtomicType("binary", "binary");
    public static final AtomicType BooleanType = new AtomicType("boolean", "boolean");
    public static final AtomicType DateType = new AtomicType("date", "date");
    public static final AtomicType TimestampType = new AtomicType("timestamp", "timestamp");
    public static final AtomicType DoubleType = new AtomicType("double", "double");
    public static final AtomicType FloatType = new AtomicType("float", "float");
    public static final AtomicType ByteType = new AtomicType("byte", "tinyint");
    public static final AtomicType IntegerType = new AtomicType("integer", "int");
    public static final AtomicType LongType = new AtomicType("long", "bigint");
    public static final AtomicType ShortType = new AtomicType("short", "smallint");

    private static final Map<String, AtomicType> ATOMIC_TYPES;

    static {
        ImmutableMap.Builder<String, AtomicType> builder = ImmutableMap.builder();
        for (AtomicType type : new AtomicType[] {NullType, StringType, BinaryType, BooleanType, DateType,
                TimestampType, DoubleType, FloatType, ByteType, IntegerType, LongType, ShortType}) {
            builder.put(type.typeName(), type);
        }
        ATOMIC_TYPES = builder.build();
    }

    private DataTypes() {}

    /**
     * @return 未知类型名返回null
     * */
    static AtomicType atomicType(String typeName) {
        return ATOMIC_TYPES.get(typeName);
    }

    public static DecimalType createDecimalType(int precision, int scale) {
        return new DecimalType(precision, scale);
    }

    public static ArrayType createArrayType(DataType elementType) {
        return new ArrayType(elementType, true);
    }

    public static ArrayType createArrayType(DataType elementType, boolean containsNull) {
        return new ArrayType(elementType, containsNull);
    }

    public static MapType createMapType(DataType keyType, DataType valueType) {
        return new MapType(keyType, valueType, true);
    }

    public static MapType createMapType(DataType keyType, DataType valueType, boolean valueContainsNull) {
        return new MapType(keyType, valueType, valueContainsNull);
    }

    public static StructField createStructField(String name, DataType dataType, boolean nullable) {
        return new StructField(name, dataType, nullable);
    }

    public static StructType createStructType(StructField... fields) {
        return new StructType(fields);
    }
}

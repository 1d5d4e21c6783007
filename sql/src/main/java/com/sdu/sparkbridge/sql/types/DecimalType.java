package com.sdu.sparkbridge.sql.types;

import com.fasterxml.jackson.databind.JsonNode;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 定点小数, JSON编码为"decimal(precision,scale)"
 *
 * @author hanhan.zhang
 * */
public class DecimalType extends DataType {

    static final String TYPE_NAME = "decimal";

    public static final int MAX_PRECISION = 38;

    public static final DecimalType USER_DEFAULT = new DecimalType(10, 0);

    private final int precision;

    private final int scale;

    public DecimalType(int precision, int scale) {
        checkArgument(precision > 0 && precision <= MAX_PRECISION,
                "decimal precision %s must be in [1, %s]", precision, MAX_PRECISION);
        checkArgument(scale >= 0 && scale <= precision,
                "decimal scale %s must be in [0, precision %s]", scale, precision);
        this.precision = precision;
        this.scale = scale;
    }

    public int getPrecision() {
        return precision;
    }

    public int getScale() {
        return scale;
    }

    @Override
    public String typeName() {
        return String.format("%s(%d,%d)", TYPE_NAME, precision, scale);
    }

    @Override
    public JsonNode jsonValue() {
        return NODES.textNode(typeName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DecimalType that = (DecimalType) o;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return 31 * precision + scale;
    }
}

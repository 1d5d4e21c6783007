package com.sdu.sparkbridge.sql.types;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 原子类型, 实例见{@link DataTypes}
 *
 * @author hanhan.zhang
 * */
public class AtomicType extends DataType {

    private final String typeName;

    private final String simpleString;

    AtomicType(String typeName, String simpleString) {
        this.typeName = typeName;
        this.simpleString = simpleString;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public String simpleString() {
        return simpleString;
    }

    @Override
    public JsonNode jsonValue() {
        return NODES.textNode(typeName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return typeName().equals(((AtomicType) o).typeName());
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }
}

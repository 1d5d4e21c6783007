package com.sdu.sparkbridge.utils.scala;

import com.google.common.base.Objects;

/**
 * @author hanhan.zhang
 * */
public class Tuple4<T1, T2, T3, T4> implements Product {

    private final T1 _1;
    private final T2 _2;
    private final T3 _3;
    private final T4 _4;

    public Tuple4(T1 _1, T2 _2, T3 _3, T4 _4) {
        this._1 = _1;
        this._2 = _2;
        this._3 = _3;
        this._4 = _4;
    }

    public T1 _1() {
        return _1;
    }

    public T2 _2() {
        return _2;
    }

    public T3 _3() {
        return _3;
    }

    public T4 _4() {
        return _4;
    }

    @Override
    public Object productElement(int n) {
        switch (n) {
            case 1:
                return _1;
            case 2:
                return _2;
            case 3:
                return _3;
            case 4:
                return _4;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(n));
        }
    }

    @Override
    public int productArity() {
        return 4;
    }

    @Override
    public boolean canEqual(Object that) {
        return that instanceof Tuple4;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Tuple4<?, ?, ?, ?> that = (Tuple4<?, ?, ?, ?>) o;
        return Objects.equal(_1, that._1) && Objects.equal(_2, that._2)
                && Objects.equal(_3, that._3) && Objects.equal(_4, that._4);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_1, _2, _3, _4);
    }

    @Override
    public String toString() {
        return String.format("(%s, %s, %s, %s)", _1, _2, _3, _4);
    }
}

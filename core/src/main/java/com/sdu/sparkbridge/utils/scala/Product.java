package com.sdu.sparkbridge.utils.scala;

import java.io.Serializable;
import java.util.Iterator;

/**
 * @author hanhan.zhang
 * */
public interface Product extends Serializable {

    Object productElement(int n);

    int productArity();

    boolean canEqual(Object that);

    default Iterator<Object> productIterator() {
        return new Iterator<Object>() {
            int c = 1;
            int max = productArity();
            @Override
            public boolean hasNext() {
                return c <= max;
            }

            @Override
            public Object next() {
                Object result = productElement(c);
                c += 1;
                return result;
            }
        };
    }
}

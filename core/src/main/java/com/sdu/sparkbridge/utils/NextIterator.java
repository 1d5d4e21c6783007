package com.sdu.sparkbridge.utils;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 惰性遍历器: 子类在getNext()中生成下一个元素, 无元素时设置finished = true
 *
 * @author hanhan.zhang
 * */
public abstract class NextIterator<U> implements Iterator<U> {

    private boolean gotNext = false;
    private U nextValue;
    private boolean closed = false;
    protected boolean finished = false;

    @Override
    public boolean hasNext() {
        if (!finished) {
            if (!gotNext) {
                nextValue = getNext();
                if (finished) {
                    closeIfNeeded();
                }
                gotNext = true;
            }
        }
        return !finished;
    }

    @Override
    public U next() {
        if (!hasNext()) {
            throw new NoSuchElementException("End of stream");
        }
        gotNext = false;
        return nextValue;
    }

    protected void closeIfNeeded() {
        if (!closed) {
            closed = true;
            close();
        }
    }

    protected abstract U getNext();

    protected void close() { }
}

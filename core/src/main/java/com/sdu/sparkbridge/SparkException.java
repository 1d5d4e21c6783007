package com.sdu.sparkbridge;

/**
 * 所有库内异常的根类
 *
 * @author hanhan.zhang
 * */
public class SparkException extends RuntimeException {

    public SparkException(String message) {
        super(message);
    }

    public SparkException(Throwable cause) {
        super(cause);
    }

    public SparkException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.lineweave.core;

/**
 * 排版引擎异常：配置非法或实例生命周期被误用
 */
public class PrettyPrintException extends RuntimeException {

    public PrettyPrintException(String message) {
        super(message);
    }

    public PrettyPrintException(String message, Throwable cause) {
        super(message, cause);
    }
}

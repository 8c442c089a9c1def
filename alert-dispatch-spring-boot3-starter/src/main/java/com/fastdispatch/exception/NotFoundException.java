package com.fastdispatch.exception;

/**
 * 查找的告警或事件不存在
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}

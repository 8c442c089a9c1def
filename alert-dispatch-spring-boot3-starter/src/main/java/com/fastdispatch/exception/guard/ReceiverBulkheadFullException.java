package com.fastdispatch.exception.guard;

/**
 * 接收者并发已满
 * 本次 flush 视为失败, 告警留待下次
 */
public class ReceiverBulkheadFullException extends RuntimeException {

    public ReceiverBulkheadFullException(String receiver, Throwable cause) {
        super("receiver bulkhead full: " + receiver, cause);
    }
}

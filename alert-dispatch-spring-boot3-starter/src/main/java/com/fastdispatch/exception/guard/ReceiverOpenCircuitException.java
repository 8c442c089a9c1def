package com.fastdispatch.exception.guard;

/**
 * 接收者熔断打开
 * 本次 flush 视为失败, 告警留待下次
 */
public class ReceiverOpenCircuitException extends RuntimeException {

    public ReceiverOpenCircuitException(String receiver, Throwable cause) {
        super("receiver circuit open: " + receiver, cause);
    }
}

package com.fastdispatch.exception.guard;

public class ReceiverRateLimitedException extends RuntimeException {

    public ReceiverRateLimitedException(String receiver, Throwable cause) {
        super("receiver rate limited: " + receiver, cause);
    }
}

package com.aiinpocket.adwatch.exception;

/** 單次通知發送失敗，由 BackoffRetrier 決定是否重試 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

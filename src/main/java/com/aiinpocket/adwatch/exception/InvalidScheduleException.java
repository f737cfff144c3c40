package com.aiinpocket.adwatch.exception;

/**
 * cron 排程運算式無法解析。
 * 監控器不會被註冊到排程器，錯誤回傳給建立 / 改排程的呼叫端。
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.aiinpocket.adwatch.exception;

/** 監控器參數不合法（查詢字串空白、價格區間顛倒、通知目標缺欄位） */
public class WatcherValidationException extends IllegalArgumentException {

    public WatcherValidationException(String message) {
        super(message);
    }
}

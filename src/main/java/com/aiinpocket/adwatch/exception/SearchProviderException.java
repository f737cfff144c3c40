package com.aiinpocket.adwatch.exception;

/**
 * 搜尋 API 呼叫失敗或回應無法解析。
 * 只中止當次執行週期，下一次排程觸發時自然重試。
 */
public class SearchProviderException extends RuntimeException {

    public SearchProviderException(String message) {
        super(message);
    }

    public SearchProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}

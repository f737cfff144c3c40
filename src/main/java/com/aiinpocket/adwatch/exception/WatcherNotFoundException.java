package com.aiinpocket.adwatch.exception;

public class WatcherNotFoundException extends RuntimeException {

    public WatcherNotFoundException(String watcherId) {
        super("找不到監控器: " + watcherId);
    }
}

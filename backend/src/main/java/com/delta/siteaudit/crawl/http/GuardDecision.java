package com.delta.siteaudit.crawl.http;

public record GuardDecision(boolean allowed, String errorCode, String reason) {

    public static GuardDecision allow() {
        return new GuardDecision(true, null, null);
    }

    public static GuardDecision reject(String errorCode, String reason) {
        return new GuardDecision(false, errorCode, reason);
    }
}

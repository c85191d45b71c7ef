package com.delta.siteaudit.generation.model;

public record ContentNeed(String contentType, String whatItUnlocks, ContentStatus status, String whatWeSaw) {
}

package com.delta.siteaudit.generation.model;

public record MissingElement(String key, String label, String impact, Severity severity) {
}

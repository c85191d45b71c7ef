package com.delta.siteaudit.render;

public record RenderedDocument(String fileName, String contentType, byte[] content) {
}

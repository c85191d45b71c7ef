package com.delta.siteaudit.render;

public class RendererUnavailableException extends RuntimeException {
    public RendererUnavailableException() {
        super("Document export is not configured");
    }
}

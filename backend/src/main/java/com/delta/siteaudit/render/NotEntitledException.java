package com.delta.siteaudit.render;

public class NotEntitledException extends RuntimeException {
    public NotEntitledException(String jobId) {
        super("Export of audit " + jobId + " requires an entitlement");
    }
}

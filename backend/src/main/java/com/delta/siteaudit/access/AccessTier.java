package com.delta.siteaudit.access;

/**
 * Caller access levels, lowest first. Each tier sees at least what the one below it sees.
 */
public enum AccessTier {
    ANONYMOUS,
    REGISTERED,
    ENTITLED
}

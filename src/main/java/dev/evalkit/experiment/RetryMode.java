package dev.evalkit.experiment;

/**
 * Requested retry scope. Every mode currently starts a full new run; the narrower modes are
 * accepted so callers can already express them.
 */
public enum RetryMode {
    RETRY_ALL,
    RETRY_FAILURE,
    RETRY_TARGET_ITEMS
}

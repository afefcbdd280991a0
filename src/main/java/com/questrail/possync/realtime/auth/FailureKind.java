package com.questrail.possync.realtime.auth;

/**
 * Outcome of classifying an abnormal socket closure.
 */
public enum FailureKind
{
    /** The backend rejected the credential. Retrying with the same token is futile. */
    AUTH_FAILURE,

    /** Network or server trouble. A backed-off retry is appropriate. */
    TRANSIENT
}

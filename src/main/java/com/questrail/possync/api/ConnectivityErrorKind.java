package com.questrail.possync.api;

/**
 * Classification of connectivity errors, whether published on the
 * {@code error} channel or carried by a {@link ConnectivityException}.
 *
 * <p>Malformed inbound messages and sends while disconnected are not errors
 * in this sense: they are logged and reported to the observability sink, and
 * the connection carries on.</p>
 */
public enum ConnectivityErrorKind
{
    /** No user identity could be resolved for a connect attempt. */
    MISSING_IDENTITY,

    /** No bearer token was available for a connect attempt. */
    MISSING_CREDENTIAL,

    /** Abnormal closure not attributed to authentication; handled by backoff. */
    TRANSIENT_NETWORK,

    /** Closure or poll response attributed to a rejected credential. */
    AUTHENTICATION,

    /** Reconnect ceiling reached; the polling fallback takes over. */
    MAX_RETRIES_EXCEEDED,

    /** The backend reported an error through an inbound {@code error} message. */
    SERVER_REPORTED
}

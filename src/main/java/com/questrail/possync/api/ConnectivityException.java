package com.questrail.possync.api;

/**
 * Base type for the few connectivity failures that are thrown to the caller
 * rather than published on the {@code error} channel.
 *
 * <p>Only precondition failures of an explicit {@code connect()} call are
 * thrown. Everything that happens after a connection attempt has been accepted
 * is reported through events and state.</p>
 */
public abstract class ConnectivityException extends RuntimeException
{
    private final ConnectivityErrorKind kind;

    protected ConnectivityException(ConnectivityErrorKind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    public ConnectivityErrorKind kind()
    {
        return kind;
    }
}

package com.questrail.possync.api;

/**
 * Thrown by {@code connect()} when no user identity can be resolved.
 */
public final class MissingIdentityException extends ConnectivityException
{
    public MissingIdentityException(String message)
    {
        super(ConnectivityErrorKind.MISSING_IDENTITY, message);
    }
}

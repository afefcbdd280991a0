package com.questrail.possync.api;

/**
 * Thrown by {@code connect()} when no non-empty bearer token is available.
 */
public final class MissingCredentialException extends ConnectivityException
{
    public MissingCredentialException(String message)
    {
        super(ConnectivityErrorKind.MISSING_CREDENTIAL, message);
    }
}

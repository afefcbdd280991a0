package com.questrail.possync.realtime.poll;

/**
 * Raw outcome of one active-state request.
 *
 * @param status HTTP status code
 * @param body   response body, empty when none
 */
public record ActiveStateResponse(int status, String body)
{
    public ActiveStateResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccess()
    {
        return status >= 200 && status < 300;
    }

    /**
     * 401 and 403: the credential was refused.
     */
    public boolean isAuthRejection()
    {
        return status == 401 || status == 403;
    }
}

package com.questrail.possync.realtime.internal.exec;

import com.questrail.possync.realtime.internal.state.SupervisorIntents;

/**
 * SupervisorIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure connection state machine and the impure
 * world of sockets, timers, HTTP polling and bus listeners.
 *
 * <h2>Role in the architecture</h2>
 * Implementations realize the intents produced by the
 * {@link com.questrail.possync.realtime.internal.state.SupervisorReducer}. It is
 * the ONLY layer allowed to:
 * <ul>
 *   <li>Open, write to and close sockets</li>
 *   <li>Arm or cancel timers</li>
 *   <li>Start or stop the polling fallback</li>
 *   <li>Publish on the event bus</li>
 * </ul>
 *
 * Execution must be <b>non-blocking</b>. Outcomes (socket callbacks, timer
 * firings, poll rejections) are reported back to the supervisor as events,
 * never as return values.
 */
public interface SupervisorIntentExecutor
{
    /**
     * Execute the supplied intents in {@link SupervisorIntents.Kind} order.
     *
     * @param intents immutable set of actions to perform
     */
    void execute(SupervisorIntents intents);
}

/**
 * Realtime Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete WebSocket client and the
 * connection supervisor.
 *
 * <h2>Why these ports exist</h2>
 * Production uses Netty, but Netty types must not leak into the supervisor,
 * the reducer or the tests. Everything above this package sees only:
 * <ul>
 *   <li>text messages as {@code String}</li>
 *   <li>close codes and reasons</li>
 *   <li>open/close lifecycle notifications</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations perform transport I/O only. They do not decode envelopes,
 * classify closures, reconnect or schedule timers. WebSocket control frames
 * (ping/pong at the frame level) are handled internally and never surface.
 */
package com.questrail.possync.realtime.transport;

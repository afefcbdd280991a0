package com.questrail.possync.realtime.model;

import java.util.List;

/**
 * Message type vocabulary of the POS realtime endpoint.
 */
public final class MessageTypes
{
    // Outbound control messages
    public static final String PING = "ping";
    public static final String SUBSCRIBE = "subscribe";
    public static final String AUTHENTICATE = "authenticate";

    // Inbound system messages
    public static final String PONG = "pong";
    public static final String CONNECTION_ESTABLISHED = "connection_established";
    public static final String SUBSCRIPTION_CONFIRMED = "subscription_confirmed";
    public static final String ERROR = "error";
    public static final String AUTH_ERROR = "auth_error";
    public static final String TOKEN_EXPIRED = "token_expired";

    // Business messages
    public static final String ORDER_CREATED = "order.created";
    public static final String ORDER_UPDATED = "order.updated";
    public static final String ORDER_STATUS_CHANGED = "order.status_changed";
    public static final String PAYMENT_PROCESSED = "payment.processed";
    public static final String INVENTORY_UPDATED = "inventory.updated";
    public static final String MENU_UPDATED = "menu.updated";
    public static final String STAFF_UPDATE = "staff.update";
    public static final String SETTINGS_UPDATED = "settings.updated";
    public static final String SYSTEM_NOTIFICATION = "system.notification";

    /**
     * Business event types subscribed on every successful connection, in the
     * order they are sent.
     */
    public static final List<String> BUSINESS_EVENTS = List.of(
            ORDER_CREATED,
            ORDER_UPDATED,
            ORDER_STATUS_CHANGED,
            PAYMENT_PROCESSED,
            INVENTORY_UPDATED,
            MENU_UPDATED,
            STAFF_UPDATE,
            SETTINGS_UPDATED,
            SYSTEM_NOTIFICATION
    );

    private MessageTypes() {}
}

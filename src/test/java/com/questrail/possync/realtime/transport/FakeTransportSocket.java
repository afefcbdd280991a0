package com.questrail.possync.realtime.transport;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory {@link TransportSocket}. Records what the client writes and lets
 * tests play the server side.
 */
public final class FakeTransportSocket implements TransportSocket {

    private final URI address;
    private final List<String> subprotocols;
    private final TransportSocketListener listener;
    private final List<String> sent = new ArrayList<>();

    private boolean openCalled;
    private boolean open;
    private boolean closeReported;
    private int clientCloseCode = -1;
    private String clientCloseReason;

    FakeTransportSocket(URI address, List<String> subprotocols, TransportSocketListener listener) {
        this.address = address;
        this.subprotocols = List.copyOf(subprotocols);
        this.listener = listener;
    }

    @Override
    public void open() {
        openCalled = true;
    }

    @Override
    public boolean send(String text) {
        if (!open) {
            return false;
        }
        sent.add(text);
        return true;
    }

    @Override
    public void close(int code, String reason) {
        if (clientCloseCode != -1) {
            return;
        }
        clientCloseCode = code;
        clientCloseReason = reason;
        serverCloses(code, reason);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    // ---------------------------------------------------------------------
    // Server side
    // ---------------------------------------------------------------------

    public void serverAccepts() {
        open = true;
        listener.onOpen();
    }

    public void serverSends(String json) {
        listener.onMessage(json);
    }

    public void serverCloses(int code, String reason) {
        open = false;
        if (!closeReported) {
            closeReported = true;
            listener.onClose(code, reason);
        }
    }

    /**
     * Replays an open callback regardless of state, as a late callback from a
     * superseded socket would.
     */
    public void replayOpen() {
        listener.onOpen();
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    public URI address() {
        return address;
    }

    public List<String> subprotocols() {
        return subprotocols;
    }

    public boolean openCalled() {
        return openCalled;
    }

    public List<String> sent() {
        return List.copyOf(sent);
    }

    public List<String> sentOfType(String type) {
        String marker = "\"type\":\"" + type + "\"";
        return sent.stream().filter(s -> s.contains(marker)).toList();
    }

    public boolean closedByClient() {
        return clientCloseCode != -1;
    }

    public int clientCloseCode() {
        return clientCloseCode;
    }

    public String clientCloseReason() {
        return clientCloseReason;
    }
}

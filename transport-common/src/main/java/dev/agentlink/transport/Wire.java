package dev.agentlink.transport;

import dev.agentlink.protocol.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs framed traffic in one format so that client and server logs line up.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_LOGGED_CHARS = 200;

    private Wire() {
    }

    public static void rx(String connectionId, Envelope envelope, String json) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX conn={} kind={} method={} id={} json={}",
                connectionId, kind(envelope), envelope.method(), envelope.id(), truncate(json, MAX_LOGGED_CHARS));
        }
    }

    public static void tx(String connectionId, Envelope envelope, String json) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX conn={} kind={} method={} id={} json={}",
                connectionId, kind(envelope), envelope.method(), envelope.id(), truncate(json, MAX_LOGGED_CHARS));
        }
    }

    public static void malformed(String connectionId, String reason, String frame) {
        LOGGER.warn("RX conn={} dropped undecodable frame ({}): {}", connectionId, reason, truncate(frame, MAX_LOGGED_CHARS));
    }

    private static String kind(Envelope envelope) {
        if (envelope.isRequest()) {
            return "request";
        }
        if (envelope.isNotification()) {
            return "notification";
        }
        return envelope.error() != null ? "error" : "response";
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}

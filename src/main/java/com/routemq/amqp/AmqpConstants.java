package com.routemq.amqp;

/**
 * AMQP 0-9-1 constants used by the routing core.
 */
public final class AmqpConstants {

    private AmqpConstants() {
        // Utility class
    }

    // ===== Class IDs =====
    public static final short CLASS_EXCHANGE = 40;
    public static final short CLASS_QUEUE = 50;

    // ===== Exchange Method IDs =====
    public static final short METHOD_EXCHANGE_DECLARE = 10;
    public static final short METHOD_EXCHANGE_DELETE = 20;

    // ===== Queue Method IDs =====
    public static final short METHOD_QUEUE_BIND = 20;
    public static final short METHOD_QUEUE_UNBIND = 50;

    // ===== AMQP Reply Codes =====
    public static final int REPLY_ACCESS_REFUSED = 403;
    public static final int REPLY_NOT_FOUND = 404;
    public static final int REPLY_PRECONDITION_FAILED = 406;
    public static final int REPLY_COMMAND_INVALID = 503;
    public static final int REPLY_NOT_IMPLEMENTED = 540;

    // ===== Naming =====
    public static final String RESERVED_EXCHANGE_PREFIX = "amq.";
    public static final String DEFAULT_EXCHANGE = "";
    public static final String DEFAULT_VIRTUAL_HOST = "/";

    // ===== Headers exchange binding arguments =====
    public static final String HEADERS_MATCH_ARGUMENT = "x-match";
}

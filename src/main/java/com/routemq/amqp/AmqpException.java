package com.routemq.amqp;

/**
 * A channel-level error raised by a core operation, carrying the AMQP reply code
 * and the class/method that caused it so the protocol layer can close the channel.
 */
public class AmqpException extends RuntimeException {
    private final int replyCode;
    private final short classId;
    private final short methodId;

    public AmqpException(int replyCode, String message, short classId, short methodId) {
        super(message);
        this.replyCode = replyCode;
        this.classId = classId;
        this.methodId = methodId;
    }

    public static AmqpException notFound(String message, short classId, short methodId) {
        return new AmqpException(AmqpConstants.REPLY_NOT_FOUND, message, classId, methodId);
    }

    public static AmqpException accessRefused(String message, short classId, short methodId) {
        return new AmqpException(AmqpConstants.REPLY_ACCESS_REFUSED, message, classId, methodId);
    }

    public static AmqpException preconditionFailed(String message, short classId, short methodId) {
        return new AmqpException(AmqpConstants.REPLY_PRECONDITION_FAILED, message, classId, methodId);
    }

    public static AmqpException commandInvalid(String message, short classId, short methodId) {
        return new AmqpException(AmqpConstants.REPLY_COMMAND_INVALID, message, classId, methodId);
    }

    public static AmqpException notImplemented(String message, short classId, short methodId) {
        return new AmqpException(AmqpConstants.REPLY_NOT_IMPLEMENTED, message, classId, methodId);
    }

    public int getReplyCode() {
        return replyCode;
    }

    public short getClassId() {
        return classId;
    }

    public short getMethodId() {
        return methodId;
    }

    @Override
    public String toString() {
        return String.format("AmqpException{replyCode=%d, classId=%d, methodId=%d, message='%s'}",
                replyCode, classId, methodId, getMessage());
    }
}

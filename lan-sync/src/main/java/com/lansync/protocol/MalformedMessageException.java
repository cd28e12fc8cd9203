package com.lansync.protocol;

/**
 * A received line or datagram could not be turned into a valid message.
 *
 * Always handled where it is raised: the offending record is logged and dropped.
 */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

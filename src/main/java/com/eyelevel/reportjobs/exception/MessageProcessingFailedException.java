package com.eyelevel.reportjobs.exception;

import java.io.Serial;

/**
 * Thrown when an SQS message consumer fails to process a message, signaling that the message should be left
 * on the queue for redelivery.
 * NOTE: This is an internal exception and should NOT be handled by the GlobalExceptionHandler.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -8146920034557130716L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.queueflow;

/**
 * Thrown when a trigger payload is not an instance of the payload type the task
 * was declared with.
 */
public final class PayloadTypeException extends IllegalArgumentException {

    public PayloadTypeException(String message) {
        super(message);
    }
}

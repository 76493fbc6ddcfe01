package com.ads.signaldetection.output;

/**
 * A batch of anomaly events could not be handed to the downstream memory system.
 */
public class DeliveryFailureException extends RuntimeException {

    public DeliveryFailureException(String message) {
        super(message);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

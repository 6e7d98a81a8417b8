package com.fieldreport.impound.service.notification;

/**
 * The SMS gateway did not accept a message. Never reaches API callers; the dispatcher turns it
 * into a failed {@link com.fieldreport.impound.model.NotificationOutcome}.
 */
public class SmsDeliveryException extends RuntimeException {

    public SmsDeliveryException(String message) {
        super(message);
    }

    public SmsDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

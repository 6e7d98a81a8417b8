package com.fieldreport.impound.service.notification;

import java.util.Collection;

/**
 * Outbound SMS transport.
 */
public interface SmsGateway {

    /**
     * Send one message to every phone in {@code phones}.
     *
     * @throws SmsDeliveryException if the gateway refused the message or could not be reached
     */
    void send(Collection<String> phones, String message);
}

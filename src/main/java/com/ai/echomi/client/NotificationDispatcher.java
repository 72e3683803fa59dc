package com.ai.echomi.client;

/**
 * Delivers a short text to the owner's phone.
 */
public interface NotificationDispatcher {

    /**
     * @return false when the message could not be handed off; failures are logged, not thrown
     */
    boolean send(String recipientPhone, String title, String message, String type);
}

package com.ai.echomi.client;

import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the owner notification as a plain SMS through Twilio.
 */
public class TwilioSmsNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsNotificationDispatcher.class);

    private final String accountSid;
    private final String authToken;
    private final String fromNumber;
    private volatile boolean initialized;

    public TwilioSmsNotificationDispatcher(String accountSid, String authToken, String fromNumber) {
        this.accountSid = accountSid;
        this.authToken = authToken;
        this.fromNumber = fromNumber;
    }

    @Override
    public boolean send(String recipientPhone, String title, String message, String type) {
        if (StringUtils.isAnyBlank(accountSid, authToken, fromNumber)) {
            log.warn("Twilio credentials not set; skipping SMS notification");
            return false;
        }
        if (StringUtils.isBlank(recipientPhone)) {
            log.warn("No recipient for SMS notification '{}'", type);
            return false;
        }
        ensureInitialized();
        try {
            Message sms = Message.creator(new PhoneNumber(recipientPhone), new PhoneNumber(fromNumber), title + ": " + message)
                    .create();
            log.info("Twilio SMS {} queued for '{}'", sms.getSid(), type);
            return true;
        } catch (Exception ex) {
            log.error("Twilio SMS failed for '{}'", type, ex);
            return false;
        }
    }

    private synchronized void ensureInitialized() {
        if (!initialized) {
            Twilio.init(accountSid, authToken);
            initialized = true;
        }
    }
}

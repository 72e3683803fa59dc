package com.ai.echomi.service;

import com.ai.echomi.client.NotificationDispatcher;
import com.ai.echomi.conversation.FactKeys;
import com.ai.echomi.conversation.SessionContext;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the owner-facing messages and hands them to the configured dispatcher.
 * Returns false instead of throwing; a failed notification never fails a turn.
 */
@Service
public class OwnerNotifier {

    private static final Logger log = LoggerFactory.getLogger(OwnerNotifier.class);

    static final String TITLE = "Delivery Verification Required";
    static final String TYPE = "delivery_approval";

    private final NotificationDispatcher dispatcher;
    private final String ownerPhone;

    public OwnerNotifier(NotificationDispatcher dispatcher, @Value("${echomi.owner-phone:}") String ownerPhone) {
        this.dispatcher = dispatcher;
        this.ownerPhone = ownerPhone;
    }

    public boolean notifyUrgent(String message) {
        return send("URGENT: " + message);
    }

    public boolean notifyUnknownCaller(SessionContext ctx) {
        return send(unknownCallerMessage(ctx));
    }

    static String unknownCallerMessage(SessionContext ctx) {
        String name = StringUtils.defaultIfBlank(ctx.getString(FactKeys.NAME), "Unknown caller");
        String purpose = StringUtils.defaultIfBlank(ctx.getString(FactKeys.PURPOSE), "Not specified");
        String phone = StringUtils.defaultIfBlank(ctx.getString(FactKeys.PHONE), "Not provided");
        StringBuilder message = new StringBuilder()
                .append("Unknown caller: ").append(name)
                .append(". Purpose: ").append(purpose)
                .append(". Callback: ").append(phone);
        List<String> details = ctx.getStringList(FactKeys.ADDITIONAL_DETAILS);
        if (!details.isEmpty()) {
            message.append(" Additional info: ").append(String.join(" | ", details));
        }
        return message.toString();
    }

    private boolean send(String message) {
        if (StringUtils.isBlank(ownerPhone)) {
            log.warn("Owner phone number not configured; notification dropped");
            return false;
        }
        try {
            return dispatcher.send(ownerPhone, TITLE, message, TYPE);
        } catch (RuntimeException ex) {
            log.error("Notification dispatcher failed", ex);
            return false;
        }
    }
}

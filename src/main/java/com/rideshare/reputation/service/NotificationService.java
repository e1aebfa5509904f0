package com.rideshare.reputation.service;

import com.rideshare.reputation.config.MetricsConfig;
import com.rideshare.reputation.config.TwilioNotificationConfig;
import com.rideshare.reputation.model.SideEffectOutcome;
import com.rideshare.reputation.model.UserProfile;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends user-facing messages through Twilio. Delivery is a side effect: every
 * call returns an outcome and none of them throws.
 */
@Service
public class NotificationService {

    public static final String SIDE_EFFECT_NAME = "notification";

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public NotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Observed(name = "notification.send", contextualName = "send-verification-notification")
    public SideEffectOutcome notifyVerificationDecision(UserProfile user, boolean approved, String note) {
        if (!config.isEnabled()) {
            return skip("notifications disabled");
        }
        if (user.getPhoneNumber() == null || user.getPhoneNumber().isBlank()) {
            log.warn("No phone number for user={}, verification notification not sent", user.getUid());
            return skip("user has no phone number");
        }

        try {
            String body = buildVerificationBody(user, approved, note);
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(user.getPhoneNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            metricsConfig.recordSideEffect(SIDE_EFFECT_NAME, "succeeded");
            log.info("Verification notification sent to user={}, sid={}", user.getUid(), message.getSid());
            return SideEffectOutcome.succeeded(SIDE_EFFECT_NAME);
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            metricsConfig.recordSideEffect(SIDE_EFFECT_NAME, "failed");
            log.error("Failed to send verification notification to user={}: {}", user.getUid(), e.getMessage(), e);
            return SideEffectOutcome.failed(SIDE_EFFECT_NAME, e.getMessage());
        }
    }

    private SideEffectOutcome skip(String reason) {
        metricsConfig.recordSideEffect(SIDE_EFFECT_NAME, "skipped");
        return SideEffectOutcome.skipped(SIDE_EFFECT_NAME, reason);
    }

    private String buildVerificationBody(UserProfile user, boolean approved, String note) {
        String name = user.getDisplayName() != null ? user.getDisplayName() : "there";
        StringBuilder body = new StringBuilder();
        if (approved) {
            body.append(String.format("Hi %s, your rider verification has been approved. You can now offer rides.", name));
        } else {
            body.append(String.format("Hi %s, your rider verification was not approved.", name));
        }
        if (note != null && !note.isBlank()) {
            body.append("\nNote: ").append(note);
        }
        return body.toString();
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}

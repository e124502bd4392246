package com.trading.approval.config;

import com.trading.approval.model.AlertLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * On-call paging for approval alerts. Alerts below {@code minLevel} are never sent.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String onCallNumber;
    private AlertLevel minLevel = AlertLevel.ERROR;

    public boolean pages(AlertLevel level) {
        return enabled && level != null && level.isAtLeast(minLevel);
    }
}

package tech.accessplane.platform.notification;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Configuration for outbound notifications.
 */
@ConfigMapping(prefix = "accessplane.notification")
public interface NotificationConfig {

    /**
     * Whether credential emails are sent. Off by default; when off every
     * attempt is recorded as skipped.
     */
    @WithDefault("false")
    boolean credentialEnabled();

    @WithDefault("noreply@accessplane.tech")
    String senderEmail();

    @WithDefault("https://portal.accessplane.tech/login")
    String loginUrl();

    @WithDefault("License Portal")
    String platformName();

    @WithDefault("support@accessplane.tech")
    String supportEmail();

    @WithDefault("us-east-1")
    String region();

    Optional<String> endpointOverride();
}

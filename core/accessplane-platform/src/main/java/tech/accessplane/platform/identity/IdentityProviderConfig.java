package tech.accessplane.platform.identity;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Configuration for the managed identity provider (Cognito user pool).
 */
@ConfigMapping(prefix = "accessplane.identity-provider")
public interface IdentityProviderConfig {

    /**
     * User pool id. When absent the provider is treated as not configured:
     * creation is skipped and reconciliation refuses to run.
     */
    Optional<String> userPoolId();

    @WithDefault("us-east-1")
    String region();

    Optional<String> endpointOverride();
}

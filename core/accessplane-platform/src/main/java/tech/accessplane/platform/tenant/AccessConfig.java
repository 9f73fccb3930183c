package tech.accessplane.platform.tenant;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Super-admin recognition.
 */
@ConfigMapping(prefix = "accessplane.access")
public interface AccessConfig {

    /**
     * Email that is always treated as super-admin, compared case-insensitively.
     */
    @WithDefault("admin@adminplatform.com")
    String platformAdminEmail();

    /**
     * Role or group claim that marks a super-admin.
     */
    @WithDefault("super_admin")
    String superAdminRole();
}

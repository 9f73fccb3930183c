package tech.accessplane.platform.identity;

/**
 * Attributes sent to the identity provider for one principal.
 *
 * <p>{@code email} is the lookup key upstream. For updates every other field
 * is optional; null means "leave unchanged". {@code enabled} is only used on
 * update to enable or disable sign-in.
 */
public record UserProfile(
    String email,
    String firstName,
    String lastName,
    String tenantId,
    String enterpriseId,
    String role,
    String groupName,
    Boolean enabled
) {

    public static Builder builder(String email) {
        return new Builder(email);
    }

    public static final class Builder {
        private final String email;
        private String firstName;
        private String lastName;
        private String tenantId;
        private String enterpriseId;
        private String role;
        private String groupName;
        private Boolean enabled;

        private Builder(String email) {
            this.email = email;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder enterpriseId(String enterpriseId) {
            this.enterpriseId = enterpriseId;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder groupName(String groupName) {
            this.groupName = groupName;
            return this;
        }

        public Builder enabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public UserProfile build() {
            return new UserProfile(email, firstName, lastName, tenantId, enterpriseId, role, groupName, enabled);
        }
    }
}

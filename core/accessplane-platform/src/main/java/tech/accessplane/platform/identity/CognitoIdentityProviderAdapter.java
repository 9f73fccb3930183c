package tech.accessplane.platform.identity;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminAddUserToGroupRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminCreateUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminCreateUserResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminDeleteUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminDisableUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminEnableUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminGetUserRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminGetUserResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminSetUserPasswordRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AdminUpdateUserAttributesRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.AttributeType;
import software.amazon.awssdk.services.cognitoidentityprovider.model.CognitoIdentityProviderException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.InternalErrorException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.MessageActionType;
import software.amazon.awssdk.services.cognitoidentityprovider.model.TooManyRequestsException;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cognito user pool implementation of the identity provider adapter.
 *
 * <p>The email address is the Cognito username. Tenant, enterprise and role
 * travel as the custom attributes {@code custom:account_id},
 * {@code custom:enterprise_id} and {@code custom:role}.
 *
 * <p>New users are created with the invitation message suppressed; the
 * generated password is set as permanent and returned to the caller, which
 * decides whether to send it in a credential email.
 */
@ApplicationScoped
public class CognitoIdentityProviderAdapter implements IdentityProviderAdapter {

    private static final Logger LOG = Logger.getLogger(CognitoIdentityProviderAdapter.class);

    static final String NOT_CONFIGURED_REASON = "Identity provider not configured (user pool id missing)";

    @Inject
    CognitoIdentityProviderClient cognito;

    @Inject
    IdentityProviderConfig config;

    @Override
    public boolean isConfigured() {
        return config.userPoolId().filter(id -> !id.isBlank()).isPresent();
    }

    @Override
    public ProvisionResult createUser(UserProfile profile) {
        if (!isConfigured()) {
            LOG.warnf("Skipping identity provider provisioning for %s: %s", profile.email(), NOT_CONFIGURED_REASON);
            return ProvisionResult.skipped(NOT_CONFIGURED_REASON);
        }
        String userPoolId = userPoolId();
        List<AttributeType> attributes = attributesFor(profile, true);

        try {
            Optional<AdminGetUserResponse> existing = findUser(userPoolId, profile.email());
            if (existing.isPresent()) {
                cognito.adminUpdateUserAttributes(AdminUpdateUserAttributesRequest.builder()
                    .userPoolId(userPoolId)
                    .username(profile.email())
                    .userAttributes(attributes)
                    .build());
                String sub = subOf(existing.get().userAttributes());
                ensureGroupMembership(userPoolId, profile.email(), profile.groupName());
                LOG.infof("Identity provider user exists: %s (sub: %s), attributes updated", profile.email(), sub);
                return ProvisionResult.updated(sub);
            }

            String password = TemporaryPasswords.generate();
            AdminCreateUserResponse created = cognito.adminCreateUser(AdminCreateUserRequest.builder()
                .userPoolId(userPoolId)
                .username(profile.email())
                .userAttributes(attributes)
                .messageAction(MessageActionType.SUPPRESS)
                .temporaryPassword(password)
                .build());
            String sub = created.user() != null ? subOf(created.user().attributes()) : null;

            cognito.adminSetUserPassword(AdminSetUserPasswordRequest.builder()
                .userPoolId(userPoolId)
                .username(profile.email())
                .password(password)
                .permanent(true)
                .build());

            ensureGroupMembership(userPoolId, profile.email(), profile.groupName());
            LOG.infof("Created identity provider user: %s (sub: %s)", profile.email(), sub);
            return ProvisionResult.created(sub, password);
        } catch (SdkException e) {
            throw translate("create " + profile.email(), e);
        }
    }

    @Override
    public void updateUser(UserProfile profile) {
        if (!isConfigured()) {
            LOG.debugf("Skipping identity provider update for %s: %s", profile.email(), NOT_CONFIGURED_REASON);
            return;
        }
        String userPoolId = userPoolId();

        try {
            List<AttributeType> attributes = attributesFor(profile, false);
            if (!attributes.isEmpty()) {
                cognito.adminUpdateUserAttributes(AdminUpdateUserAttributesRequest.builder()
                    .userPoolId(userPoolId)
                    .username(profile.email())
                    .userAttributes(attributes)
                    .build());
            }
            if (Boolean.FALSE.equals(profile.enabled())) {
                cognito.adminDisableUser(AdminDisableUserRequest.builder()
                    .userPoolId(userPoolId)
                    .username(profile.email())
                    .build());
            } else if (Boolean.TRUE.equals(profile.enabled())) {
                cognito.adminEnableUser(AdminEnableUserRequest.builder()
                    .userPoolId(userPoolId)
                    .username(profile.email())
                    .build());
            }
        } catch (UserNotFoundException e) {
            throw new IdentityProviderException("User " + profile.email() + " does not exist in the identity provider", e);
        } catch (SdkException e) {
            throw translate("update " + profile.email(), e);
        }
    }

    @Override
    public DeprovisionResult deleteUser(String email) {
        if (!isConfigured()) {
            return DeprovisionResult.skipped(NOT_CONFIGURED_REASON);
        }
        try {
            cognito.adminDeleteUser(AdminDeleteUserRequest.builder()
                .userPoolId(userPoolId())
                .username(email)
                .build());
            return DeprovisionResult.removed();
        } catch (UserNotFoundException e) {
            return DeprovisionResult.skipped("User not found in identity provider");
        } catch (SdkException e) {
            throw translate("delete " + email, e);
        }
    }

    private Optional<AdminGetUserResponse> findUser(String userPoolId, String email) {
        try {
            return Optional.of(cognito.adminGetUser(AdminGetUserRequest.builder()
                .userPoolId(userPoolId)
                .username(email)
                .build()));
        } catch (UserNotFoundException e) {
            return Optional.empty();
        }
    }

    private void ensureGroupMembership(String userPoolId, String email, String groupName) {
        if (groupName == null || groupName.isBlank()) {
            return;
        }
        try {
            cognito.adminAddUserToGroup(AdminAddUserToGroupRequest.builder()
                .userPoolId(userPoolId)
                .username(email)
                .groupName(groupName)
                .build());
        } catch (SdkException e) {
            LOG.warnf("Failed to add %s to group %s: %s", email, groupName, e.getMessage());
        }
    }

    /**
     * Attribute list for a profile. On create the email is marked verified and
     * the enterprise id is always sent (blank clears it); on update only the
     * non-null fields are sent.
     */
    static List<AttributeType> attributesFor(UserProfile profile, boolean create) {
        List<AttributeType> attributes = new ArrayList<>();
        if (create) {
            attributes.add(attribute("email", profile.email()));
            attributes.add(attribute("email_verified", "true"));
        }
        addIfPresent(attributes, "given_name", profile.firstName());
        addIfPresent(attributes, "family_name", profile.lastName());
        addIfPresent(attributes, "custom:account_id", profile.tenantId());
        if (create) {
            attributes.add(attribute("custom:enterprise_id", profile.enterpriseId() != null ? profile.enterpriseId() : ""));
        } else {
            addIfPresent(attributes, "custom:enterprise_id", profile.enterpriseId());
        }
        addIfPresent(attributes, "custom:role", profile.role());
        return attributes;
    }

    private static void addIfPresent(List<AttributeType> attributes, String name, String value) {
        if (value != null) {
            attributes.add(attribute(name, value));
        }
    }

    private static AttributeType attribute(String name, String value) {
        return AttributeType.builder().name(name).value(value).build();
    }

    private static String subOf(List<AttributeType> attributes) {
        if (attributes == null) {
            return null;
        }
        return attributes.stream()
            .filter(a -> "sub".equals(a.name()))
            .map(AttributeType::value)
            .findFirst()
            .orElse(null);
    }

    private String userPoolId() {
        return config.userPoolId().orElseThrow(() -> new IllegalStateException(NOT_CONFIGURED_REASON));
    }

    private static IdentityProviderException translate(String action, SdkException e) {
        boolean transientFailure = e instanceof SdkClientException
            || e instanceof TooManyRequestsException
            || e instanceof InternalErrorException
            || (e instanceof CognitoIdentityProviderException ce && ce.statusCode() >= 500);
        if (transientFailure) {
            return new IdentityProviderUnavailableException("Identity provider unavailable during " + action + ": " + e.getMessage(), e);
        }
        return new IdentityProviderException("Identity provider rejected " + action + ": " + e.getMessage(), e);
    }
}

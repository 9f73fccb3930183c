package tech.accessplane.platform.identity;

/**
 * The identity provider could not be reached or is throttling. Transient;
 * the same call may succeed on a later attempt or reconciliation run.
 */
public class IdentityProviderUnavailableException extends IdentityProviderException {

    public IdentityProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

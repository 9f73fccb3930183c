package tech.accessplane.platform.identity;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClientBuilder;

import java.net.URI;

/**
 * Produces the Cognito client. The client is only built on first use, so an
 * unconfigured deployment never creates one.
 */
@ApplicationScoped
public class CognitoClientProducer {

    @Inject
    IdentityProviderConfig config;

    @Produces
    @ApplicationScoped
    public CognitoIdentityProviderClient cognitoClient() {
        CognitoIdentityProviderClientBuilder builder = CognitoIdentityProviderClient.builder()
            .region(Region.of(config.region()))
            .credentialsProvider(DefaultCredentialsProvider.create());
        config.endpointOverride().ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)));
        return builder.build();
    }

    void close(@Disposes CognitoIdentityProviderClient client) {
        client.close();
    }
}

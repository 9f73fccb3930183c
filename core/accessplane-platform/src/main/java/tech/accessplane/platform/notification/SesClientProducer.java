package tech.accessplane.platform.notification;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.SesClientBuilder;

import java.net.URI;

@ApplicationScoped
public class SesClientProducer {

    @Inject
    NotificationConfig config;

    @Produces
    @ApplicationScoped
    public SesClient sesClient() {
        SesClientBuilder builder = SesClient.builder()
            .region(Region.of(config.region()))
            .credentialsProvider(DefaultCredentialsProvider.create());
        config.endpointOverride().ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)));
        return builder.build();
    }

    void close(@Disposes SesClient client) {
        client.close();
    }
}

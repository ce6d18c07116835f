package com.xammer.remediation.config;

import com.google.api.gax.retrying.RetrySettings;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.resourcemanager.v3.OrganizationsClient;
import com.google.cloud.resourcemanager.v3.OrganizationsSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

@Configuration
@EnableConfigurationProperties(RemediationProperties.class)
@Slf4j
public class GcpConfig {

    private static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    @Bean
    public GoogleCredentials googleCredentials(RemediationProperties properties) throws IOException {
        String location = properties.getGcp().getCredentialsLocation();
        if (location == null || location.isBlank()) {
            log.info("Using Application Default Credentials for Resource Manager");
            return GoogleCredentials.getApplicationDefault().createScoped(CLOUD_PLATFORM_SCOPE);
        }
        log.info("Using service account key from {}", location);
        try (InputStream in = new FileInputStream(location)) {
            return GoogleCredentials.fromStream(in).createScoped(CLOUD_PLATFORM_SCOPE);
        }
    }

    /**
     * Every call made through this client is bounded by {@code remediation.gcp.rpc-timeout}.
     */
    @Bean(destroyMethod = "close")
    public OrganizationsClient organizationsClient(GoogleCredentials credentials,
                                                   RemediationProperties properties) throws IOException {
        org.threeten.bp.Duration rpcTimeout =
                org.threeten.bp.Duration.ofMillis(properties.getGcp().getRpcTimeout().toMillis());

        OrganizationsSettings.Builder builder = OrganizationsSettings.newBuilder()
                .setCredentialsProvider(() -> credentials);
        builder.getOrganizationSettings().setRetrySettings(
                bounded(builder.getOrganizationSettings().getRetrySettings(), rpcTimeout));
        builder.getIamPolicySettings().setRetrySettings(
                bounded(builder.getIamPolicySettings().getRetrySettings(), rpcTimeout));
        builder.setIamPolicySettings().setRetrySettings(
                bounded(builder.setIamPolicySettings().getRetrySettings(), rpcTimeout));
        return OrganizationsClient.create(builder.build());
    }

    private static RetrySettings bounded(RetrySettings defaults, org.threeten.bp.Duration timeout) {
        return defaults.toBuilder()
                .setInitialRpcTimeout(timeout)
                .setMaxRpcTimeout(timeout)
                .setTotalTimeout(timeout)
                .build();
    }
}

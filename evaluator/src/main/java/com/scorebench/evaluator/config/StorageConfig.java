package com.scorebench.evaluator.config;

import com.scorebench.evaluator.storage.LocalStorageBackend;
import com.scorebench.evaluator.storage.S3StorageBackend;
import com.scorebench.evaluator.storage.StorageBackend;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Selects the object store behind {@link StorageBackend}.
 *
 *   scorebench.storage.backend=s3     → private S3 bucket (default)
 *   scorebench.storage.backend=local  → directory on this host, served by SignedFileController
 */
@Configuration
public class StorageConfig {

    @Configuration
    @ConditionalOnProperty(name = "scorebench.storage.backend", havingValue = "s3", matchIfMissing = true)
    static class S3 {

        @Value("${scorebench.storage.s3.region:us-east-1}")
        private String region;

        // Set for S3-compatible stores (MinIO, Ceph); empty means AWS.
        @Value("${scorebench.storage.s3.endpoint:}")
        private String endpoint;

        @Bean(destroyMethod = "close")
        S3Client s3Client() {
            var builder = S3Client.builder()
                    .region(Region.of(region))
                    .credentialsProvider(DefaultCredentialsProvider.create());
            if (!endpoint.isBlank()) {
                builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
            }
            return builder.build();
        }

        @Bean(destroyMethod = "close")
        S3Presigner s3Presigner() {
            var builder = S3Presigner.builder()
                    .region(Region.of(region))
                    .credentialsProvider(DefaultCredentialsProvider.create());
            if (!endpoint.isBlank()) {
                builder.endpointOverride(URI.create(endpoint))
                       .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
            }
            return builder.build();
        }

        @Bean
        StorageBackend s3StorageBackend(S3Client s3Client,
                                        S3Presigner s3Presigner,
                                        @Value("${scorebench.storage.s3.private-bucket}") String bucket) {
            return new S3StorageBackend(s3Client, s3Presigner, bucket);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "scorebench.storage.backend", havingValue = "local")
    static class Local {

        @Bean
        LocalStorageBackend localStorageBackend(
                @Value("${scorebench.storage.local.root}") String root,
                @Value("${scorebench.storage.local.base-url}") String baseUrl,
                @Value("${scorebench.storage.local.signing-key}") String signingKey) {
            return new LocalStorageBackend(Path.of(root), baseUrl, signingKey, Clock.systemUTC());
        }
    }
}

package com.libragraph.drive.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
@IfBuildProperty(name = "drive.blob-store.type", stringValue = "s3")
public class MinioClientProducer {

    @ConfigProperty(name = "drive.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "drive.minio.access-key")
    String accessKey;

    @ConfigProperty(name = "drive.minio.secret-key")
    String secretKey;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        return MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey)
                .build();
    }
}

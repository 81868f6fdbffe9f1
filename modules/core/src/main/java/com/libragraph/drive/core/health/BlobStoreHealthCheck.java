package com.libragraph.drive.core.health;

import com.libragraph.drive.core.storage.BlobService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class BlobStoreHealthCheck implements HealthCheck {

    @Inject
    BlobService blobService;

    @ConfigProperty(name = "drive.blob-store.bucket", defaultValue = "file-storage")
    String bucket;

    @Override
    public HealthCheckResponse call() {
        try {
            blobService.ping(bucket);
            return HealthCheckResponse.named("blob-store")
                    .up()
                    .withData("bucket", bucket)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("blob-store")
                    .down()
                    .withData("bucket", bucket)
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}

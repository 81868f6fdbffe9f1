package com.libragraph.drive.core.health;

import com.libragraph.drive.core.dao.DatabaseDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jdbi.v3.core.Jdbi;

@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    Jdbi jdbi;

    @Override
    public HealthCheckResponse call() {
        try {
            jdbi.useExtension(DatabaseDao.class, DatabaseDao::ping);
            return HealthCheckResponse.named("database")
                    .up()
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("database")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}

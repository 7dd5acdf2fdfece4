package org.showvault.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class FlywayConfig {

    /**
     * A show database whose migration history no longer validates (an edited or renamed script)
     * is repaired and migrated again unless {@code app.database.repair-on-validation-failure} is off.
     */
    @Bean
    FlywayMigrationStrategy flywayMigrationStrategy(AppProperties appProperties) {
        return flyway -> {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                if (!appProperties.getDatabase().isRepairOnValidationFailure()) {
                    log.error("Show schema history failed validation and automatic repair is disabled");
                    throw e;
                }
                log.warn("Show schema history failed validation, repairing it: {}", e.getMessage());
                flyway.repair();
                flyway.migrate();
                log.info("Show schema migrated after repair");
            }
        };
    }
}

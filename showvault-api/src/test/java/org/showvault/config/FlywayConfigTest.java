package org.showvault.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FlywayConfigTest {

    @Mock
    private Flyway flyway;

    private AppProperties appProperties;
    private FlywayMigrationStrategy strategy;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        strategy = new FlywayConfig().flywayMigrationStrategy(appProperties);
    }

    @Test
    void cleanHistory_migratesOnce() {
        strategy.migrate(flyway);

        verify(flyway).migrate();
        verify(flyway, never()).repair();
    }

    @Test
    void validationFailure_repairsThenMigratesAgain() {
        when(flyway.migrate()).thenThrow(mock(FlywayValidateException.class)).thenReturn(null);

        strategy.migrate(flyway);

        InOrder inOrder = inOrder(flyway);
        inOrder.verify(flyway).migrate();
        inOrder.verify(flyway).repair();
        inOrder.verify(flyway).migrate();
    }

    @Test
    void validationFailure_withRepairDisabled_isRethrown() {
        appProperties.getDatabase().setRepairOnValidationFailure(false);
        FlywayValidateException failure = mock(FlywayValidateException.class);
        when(flyway.migrate()).thenThrow(failure);

        assertThatThrownBy(() -> strategy.migrate(flyway)).isSameAs(failure);
        verify(flyway, never()).repair();
    }
}

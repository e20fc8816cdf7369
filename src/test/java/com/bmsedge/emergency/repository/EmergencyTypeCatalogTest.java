package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.EmergencyType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EmergencyTypeCatalogTest {

    private final EmergencyTypeCatalog catalog = new EmergencyTypeCatalog();

    @Test
    void shouldDefineTenTypesWithValidSeverities() {
        assertThat(catalog.size()).isEqualTo(10);
        assertThat(catalog.findAll()).allSatisfy(type -> {
            assertThat(type.getBaseSeverity()).isBetween(1, 5);
            assertThat(type.getResponseProtocol()).isNotEmpty();
        });
    }

    @Test
    void shouldLeaveGenericWithoutRecoverySteps() {
        assertThat(catalog.findById(EmergencyTypeCatalog.GENERIC).map(EmergencyType::getRecoverySteps))
                .hasValueSatisfying(steps -> assertThat(steps).isEmpty());
    }

    @Test
    void shouldReturnEmptyForUnknownOrNullId() {
        assertThat(catalog.findById("volcano")).isEmpty();
        assertThat(catalog.findById(null)).isEmpty();
    }
}

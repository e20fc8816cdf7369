package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.EquipmentIssueDTO;
import com.bmsedge.emergency.model.EmergencyEquipment;
import com.bmsedge.emergency.model.enums.EquipmentStatus;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EquipmentServiceTest {

    private EngineFixture fixture;
    private EquipmentService service;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        service = fixture.equipmentService;
    }

    @Test
    void shouldFindNoIssuesInFreshInventory() {
        assertThat(service.checkStatus()).isEmpty();
        assertThat(service.countGood()).isEqualTo(10);
        assertThat(fixture.publisher.count(NotificationType.EQUIPMENT_ISSUES)).isZero();
    }

    @Test
    void shouldFlagExpiredExpiringAndLowBatteryItems() {
        // Given: 2026-03-10 today
        item("first_aid_car").setExpiryDate(LocalDate.of(2026, 3, 1));
        item("fire_ext_garage").setExpiryDate(LocalDate.of(2026, 3, 25));
        item("flashlight_basement").setBatteryLevel(12.0);

        // When
        List<EquipmentIssueDTO> issues = service.checkStatus();

        // Then
        assertThat(issues).extracting(EquipmentIssueDTO::getId, EquipmentIssueDTO::getIssue)
                .containsExactlyInAnyOrder(
                        tuple("first_aid_car", "expired"),
                        tuple("fire_ext_garage", "expiring_soon"),
                        tuple("flashlight_basement", "low_battery"));
        assertThat(item("first_aid_car").getStatus()).isEqualTo(EquipmentStatus.EXPIRED);
        assertThat(item("fire_ext_garage").getStatus()).isEqualTo(EquipmentStatus.EXPIRING_SOON);
        assertThat(fixture.publisher.count(NotificationType.EQUIPMENT_ISSUES)).isEqualTo(1);
    }

    @Test
    void shouldRecordInspectionButKeepExpiredStatus() {
        item("fire_ext_kitchen").setStatus(EquipmentStatus.EXPIRING_SOON);
        item("first_aid_main").setStatus(EquipmentStatus.EXPIRED);

        EmergencyEquipment inspected = service.inspect("fire_ext_kitchen").orElseThrow();
        service.inspect("first_aid_main");

        assertThat(inspected.getLastInspected()).isEqualTo(LocalDate.of(2026, 3, 10));
        assertThat(inspected.getStatus()).isEqualTo(EquipmentStatus.GOOD);
        assertThat(item("first_aid_main").getStatus()).isEqualTo(EquipmentStatus.EXPIRED);
        assertThat(service.inspect("crowbar")).isEmpty();
    }

    private EmergencyEquipment item(String id) {
        return fixture.equipmentRepository.findById(id).orElseThrow();
    }
}

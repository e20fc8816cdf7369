package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.WeatherAlertDTO;
import com.bmsedge.emergency.model.WeatherAlert;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WeatherAlertServiceTest {

    private EngineFixture fixture;
    private WeatherAlertService service;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        service = fixture.weatherAlertService;
    }

    @Test
    void shouldDefaultRegionAndTriggerStormAtThreshold() {
        WeatherAlert alert = service.issue(new WeatherAlertDTO("storm", 3, "Gale force winds", null));

        assertThat(alert.getRegion()).isEqualTo("Stockholm");
        assertThat(fixture.lifecycleManager.findActiveByType(EmergencyTypeCatalog.STORM))
                .hasValueSatisfying(i -> assertThat(i.getReason()).isEqualTo("Weather service: Gale force winds"));
    }

    @Test
    void shouldClearAlertOnce() {
        WeatherAlert alert = service.issue(new WeatherAlertDTO("heavy_snow", 2, "Snow tonight", "Kiruna"));

        assertThat(service.clear(alert.getId())).isPresent();
        assertThat(service.clear(alert.getId())).isEmpty();
        assertThat(service.getActiveAlerts()).isEmpty();
        assertThat(service.getHistory()).containsExactly(alert);
    }

    @Test
    void shouldKeepOnlyRecentHistory() {
        for (int i = 0; i < 25; i++) {
            service.issue(new WeatherAlertDTO("rain", 1, "Rain " + i, null));
        }

        assertThat(service.getHistory()).hasSize(20);
        assertThat(service.getHistory().get(19).getMessage()).isEqualTo("Rain 24");
    }
}

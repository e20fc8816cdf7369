package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.PowerBackupUnit;
import com.bmsedge.emergency.model.enums.PowerUnitStatus;
import com.bmsedge.emergency.model.enums.PowerUnitType;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class PowerBackupRepository {

    public static final String UPS = "ups_main";
    public static final String BATTERY = "battery_backup";
    public static final String GENERATOR = "generator_backup";

    private final Map<String, PowerBackupUnit> units = new LinkedHashMap<>();

    public PowerBackupRepository() {
        units.put(UPS, PowerBackupUnit.builder()
                .id(UPS).name("Main UPS System").type(PowerUnitType.UPS)
                .status(PowerUnitStatus.STANDBY).level(100).runtimeMinutes(45).maxLoadWatts(1500)
                .model("APC Smart-UPS 1500VA")
                .build());
        units.put(BATTERY, PowerBackupUnit.builder()
                .id(BATTERY).name("Home Battery Backup").type(PowerUnitType.BATTERY)
                .status(PowerUnitStatus.STANDBY).level(98).runtimeMinutes(240).maxLoadWatts(5000)
                .model("Tesla Powerwall 2")
                .build());
        units.put(GENERATOR, PowerBackupUnit.builder()
                .id(GENERATOR).name("Backup Generator").type(PowerUnitType.GENERATOR)
                .status(PowerUnitStatus.STANDBY).level(85).runtimeMinutes(18 * 60).maxLoadWatts(8000)
                .autoStart(true).fuelType("diesel")
                .model("Honda EU7000iS")
                .build());
    }

    public PowerBackupUnit ups() {
        return units.get(UPS);
    }

    public PowerBackupUnit battery() {
        return units.get(BATTERY);
    }

    public PowerBackupUnit generator() {
        return units.get(GENERATOR);
    }

    public Optional<PowerBackupUnit> findById(String id) {
        return Optional.ofNullable(id == null ? null : units.get(id));
    }

    public List<PowerBackupUnit> findAll() {
        return new ArrayList<>(units.values());
    }
}

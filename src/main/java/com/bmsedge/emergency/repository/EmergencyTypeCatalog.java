package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.EmergencyType;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bmsedge.emergency.model.ProtocolStep.of;
import static com.bmsedge.emergency.model.enums.ProtocolActionKind.*;

/**
 * The ten predefined emergency types with their response protocols and
 * recovery procedures.
 */
@Repository
public class EmergencyTypeCatalog {

    public static final String FIRE = "fire";
    public static final String FLOOD = "flood";
    public static final String GAS_LEAK = "gas-leak";
    public static final String CARBON_MONOXIDE = "carbon-monoxide";
    public static final String INTRUDER = "intruder";
    public static final String MEDICAL = "medical";
    public static final String POWER_FAILURE = "power-failure";
    public static final String STORM = "storm";
    public static final String EARTHQUAKE = "earthquake";
    public static final String GENERIC = "generic";

    private final Map<String, EmergencyType> types = new LinkedHashMap<>();

    public EmergencyTypeCatalog() {
        add(EmergencyType.builder()
                .id(FIRE).label("Fire").baseSeverity(5).colorCode("#FF0000").emergencyNumber("112")
                .responseStep(of(SOUND_ALARM, "Activate fire alarm sirens on all floors", "all_floors"))
                .responseStep(of(CUT_SUPPLY, "Cut HVAC system to prevent smoke spread", "hvac"))
                .responseStep(of(UNLOCK_DOORS, "Unlock all exterior doors for evacuation", "exterior"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Activate emergency lighting on evacuation routes"))
                .responseStep(of(ACTIVATE_SPRINKLERS, "Activate sprinkler system in affected zone"))
                .responseStep(of(CALL_EMERGENCY_SERVICES, "Call emergency services (112)", "112"))
                .responseStep(of(DISPLAY_MESSAGE, "Display evacuation route on smart displays", "evacuation_routes"))
                .responseStep(of(INSTRUCTION, "Monitor temperature sensors for fire spread"))
                .recoveryStep("Wait for fire department clearance")
                .recoveryStep("Ventilate affected areas")
                .recoveryStep("Inspect structural damage")
                .recoveryStep("Replace triggered smoke detectors")
                .recoveryStep("Document damage for insurance")
                .build());

        add(EmergencyType.builder()
                .id(FLOOD).label("Flood / Water Leak").baseSeverity(4).colorCode("#0066FF").emergencyNumber("112")
                .responseStep(of(CUT_SUPPLY, "Shut off main water valve automatically", "water"))
                .responseStep(of(CUT_SUPPLY, "Cut power to affected zones to prevent electrocution", "power_affected"))
                .responseStep(of(ACTIVATE_SUMP_PUMP, "Activate sump pumps if available"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Activate emergency lighting"))
                .responseStep(of(INSTRUCTION, "Move valuable items if time permits"))
                .recoveryStep("Assess water damage extent")
                .recoveryStep("Remove standing water")
                .recoveryStep("Run dehumidifiers")
                .recoveryStep("Inspect for mold growth")
                .recoveryStep("Restore power after safety check")
                .recoveryStep("Document all damages")
                .build());

        add(EmergencyType.builder()
                .id(GAS_LEAK).label("Gas Leak").baseSeverity(5).colorCode("#FFAA00").emergencyNumber("112")
                .responseStep(of(CUT_SUPPLY, "Immediately shut off gas supply valve", "gas"))
                .responseStep(of(CUT_SUPPLY, "Cut all electrical power to prevent ignition", "power"))
                .responseStep(of(OPEN_VENTILATION, "Open all windows and ventilation automatically"))
                .responseStep(of(SOUND_ALARM, "Sound evacuation alarm", "evacuation"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Activate battery emergency lighting"))
                .responseStep(of(CALL_EMERGENCY_SERVICES, "Call emergency services (112)", "112"))
                .responseStep(of(INSTRUCTION, "Do not use any electrical switches and wait outside"))
                .recoveryStep("Wait for gas company clearance")
                .recoveryStep("Professional gas line inspection")
                .recoveryStep("Ventilate entire home thoroughly")
                .recoveryStep("Relight pilot lights professionally")
                .recoveryStep("Test all gas appliances")
                .build());

        add(EmergencyType.builder()
                .id(CARBON_MONOXIDE).label("Carbon Monoxide").baseSeverity(5).colorCode("#FF6600").emergencyNumber("112")
                .responseStep(of(SOUND_ALARM, "Sound CO alarm on all floors", "all_floors"))
                .responseStep(of(CUT_SUPPLY, "Shut down all combustion appliances", "heating"))
                .responseStep(of(OPEN_VENTILATION, "Open all windows and doors for ventilation"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Activate emergency lighting"))
                .responseStep(of(CALL_EMERGENCY_SERVICES, "Call emergency services (112)", "112"))
                .responseStep(of(INSTRUCTION, "Account for all household members"))
                .recoveryStep("Professional HVAC inspection")
                .recoveryStep("Check all combustion appliances")
                .recoveryStep("Verify CO detector functionality")
                .recoveryStep("Medical follow-up for exposed persons")
                .build());

        add(EmergencyType.builder()
                .id(INTRUDER).label("Intruder / Break-in").baseSeverity(4).colorCode("#FF00FF").emergencyNumber("114 14")
                .responseStep(of(SOUND_ALARM, "Activate intruder alarm siren", "intruder"))
                .responseStep(of(ACTIVATE_LOCKDOWN, "Lock down the home and enable safe room access"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Turn on all exterior and interior lights"))
                .responseStep(of(RECORD_CAMERAS, "Begin recording on all security cameras"))
                .responseStep(of(CALL_EMERGENCY_SERVICES, "Call police (114 14)", "114 14"))
                .responseStep(of(INSTRUCTION, "Track motion sensor activity"))
                .recoveryStep("Wait for police clearance")
                .recoveryStep("Check all entry points")
                .recoveryStep("Review security camera footage")
                .recoveryStep("File police report")
                .recoveryStep("Change access codes")
                .build());

        add(EmergencyType.builder()
                .id(MEDICAL).label("Medical Emergency").baseSeverity(5).colorCode("#00CC00").emergencyNumber("112")
                .responseStep(of(CALL_EMERGENCY_SERVICES, "Call emergency services (112) immediately", "112"))
                .responseStep(of(UNLOCK_DOORS, "Unlock front door for paramedic access", "front"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Turn on all path lighting to front door"))
                .responseStep(of(DISPLAY_MESSAGE, "Prepare medical information display", "medical_info"))
                .responseStep(of(INSTRUCTION, "Clear path for stretcher access"))
                .recoveryStep("Follow up with medical provider")
                .recoveryStep("Update medical information")
                .recoveryStep("Check emergency supply inventory")
                .recoveryStep("Review response effectiveness")
                .build());

        add(EmergencyType.builder()
                .id(POWER_FAILURE).label("Power Failure").baseSeverity(2).colorCode("#333333").emergencyNumber(null)
                .responseStep(of(SWITCH_TO_BACKUP_POWER, "Switch to UPS power for critical systems", "ups"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Activate emergency lighting"))
                .responseStep(of(CUT_SUPPLY, "Reduce power consumption to essentials", "non_essential"))
                .responseStep(of(INSTRUCTION, "Monitor refrigeration temperatures"))
                .recoveryStep("Verify stable power restoration")
                .recoveryStep("Switch back from backup power")
                .recoveryStep("Check all smart devices reconnected")
                .recoveryStep("Recharge backup systems")
                .build());

        add(EmergencyType.builder()
                .id(STORM).label("Severe Weather").baseSeverity(3).colorCode("#4B0082").emergencyNumber("112")
                .responseStep(of(CLOSE_SHUTTERS, "Close all motorized shutters and blinds"))
                .responseStep(of(DISPLAY_MESSAGE, "Send weather warning to all displays", "weather_warning"))
                .responseStep(of(INSTRUCTION, "Secure outdoor furniture and items"))
                .responseStep(of(INSTRUCTION, "Stay away from windows"))
                .recoveryStep("Inspect exterior for damage")
                .recoveryStep("Check roof and gutters")
                .recoveryStep("Clear debris from property")
                .recoveryStep("Resume normal automation")
                .build());

        add(EmergencyType.builder()
                .id(EARTHQUAKE).label("Earthquake").baseSeverity(5).colorCode("#8B4513").emergencyNumber("112")
                .responseStep(of(SOUND_ALARM, "Sound earthquake alarm", "earthquake"))
                .responseStep(of(DISPLAY_MESSAGE, "Send DROP-COVER-HOLD instruction to all displays", "drop_cover_hold"))
                .responseStep(of(CUT_SUPPLY, "Shut off gas supply immediately", "gas"))
                .responseStep(of(CUT_SUPPLY, "Cut power to non-essential systems", "non_essential"))
                .responseStep(of(UNLOCK_DOORS, "Unlock all exit doors", "exits"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Activate emergency lighting"))
                .recoveryStep("Professional structural inspection")
                .recoveryStep("Check all utilities before restoring")
                .recoveryStep("Check water pipes for damage")
                .recoveryStep("Prepare for aftershocks")
                .build());

        add(EmergencyType.builder()
                .id(GENERIC).label("General Emergency").baseSeverity(3).colorCode("#800000").emergencyNumber("112")
                .responseStep(of(SOUND_ALARM, "Sound general alarm", "general"))
                .responseStep(of(ACTIVATE_EMERGENCY_LIGHTING, "Activate emergency lighting"))
                .responseStep(of(INSTRUCTION, "Account for all household members"))
                .build());
    }

    private void add(EmergencyType type) {
        types.put(type.getId(), type);
    }

    public Optional<EmergencyType> findById(String id) {
        return Optional.ofNullable(id == null ? null : types.get(id));
    }

    public List<EmergencyType> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(types.values()));
    }

    public int size() {
        return types.size();
    }
}

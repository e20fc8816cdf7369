package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.SensorReportResultDTO;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Inbound sensor events over MQTT. Topic {@code emergency/sensors/<sensorId>},
 * JSON body {@code {"eventType": "...", ...payload}}.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "emergency.mqtt.enabled", havingValue = "true")
public class MqttSensorEventService {

    private final EmergencyResponseService emergencyResponseService;
    private final ObjectMapper objectMapper;

    @Value("${mqtt.broker.url:tcp://localhost:1883}")
    private String brokerUrl;

    @Value("${mqtt.username:}")
    private String username;

    @Value("${mqtt.password:}")
    private String password;

    @Value("${mqtt.topic:emergency/sensors/#}")
    private String topic;

    @Value("${mqtt.client.id:emergency-response-engine}")
    private String clientId;

    private MqttClient mqttClient;

    public MqttSensorEventService(EmergencyResponseService emergencyResponseService, ObjectMapper objectMapper) {
        this.emergencyResponseService = emergencyResponseService;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        try {
            connectToMqtt();
            mqttClient.subscribe(topic, 1);
            log.info("✅ Subscribed to topic: {}", topic);
        } catch (MqttException e) {
            log.error("❌ Failed to initialize MQTT sensor feed", e);
        }
    }

    private void connectToMqtt() throws MqttException {
        mqttClient = new MqttClient(brokerUrl, clientId, new MemoryPersistence());

        MqttConnectOptions options = new MqttConnectOptions();
        if (username != null && !username.isEmpty()) {
            options.setUserName(username);
            options.setPassword(password.toCharArray());
        }
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setConnectionTimeout(10);
        options.setKeepAliveInterval(60);

        mqttClient.setCallback(new MqttCallback() {
            @Override
            public void connectionLost(Throwable cause) {
                log.error("❌ MQTT connection lost", cause);
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                handleMessage(topic, new String(message.getPayload(), StandardCharsets.UTF_8));
            }

            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
                // Subscriber only
            }
        });

        mqttClient.connect(options);
        log.info("✅ Connected to MQTT broker: {}", brokerUrl);
    }

    /**
     * Parses one sensor message and reports it to the engine.
     *
     * @return empty when the topic or body is not a sensor event
     */
    public Optional<SensorReportResultDTO> handleMessage(String topic, String payload) {
        String sensorId = sensorIdFrom(topic);
        if (sensorId == null) {
            log.warn("Ignoring message on unexpected topic: {}", topic);
            return Optional.empty();
        }

        try {
            Map<String, Object> body = objectMapper.readValue(payload, new TypeReference<Map<String, Object>>() {});
            Object eventType = body.remove("eventType");
            if (eventType == null) {
                log.warn("Sensor message from {} has no eventType", sensorId);
                return Optional.empty();
            }
            log.debug("📨 Topic: '{}' → sensor {} ({})", topic, sensorId, eventType);
            return Optional.of(emergencyResponseService.reportSensorEvent(sensorId, eventType.toString(), body));
        } catch (Exception e) {
            log.error("❌ Error processing sensor message on {}: {}", topic, e.getMessage());
            return Optional.empty();
        }
    }

    // emergency/sensors/<sensorId>
    static String sensorIdFrom(String topic) {
        if (topic == null) {
            return null;
        }
        String[] parts = topic.split("/");
        if (parts.length != 3 || !"sensors".equals(parts[1]) || parts[2].isEmpty()) {
            return null;
        }
        return parts[2];
    }

    public boolean isConnected() {
        return mqttClient != null && mqttClient.isConnected();
    }

    @PreDestroy
    public void cleanup() {
        try {
            if (mqttClient != null && mqttClient.isConnected()) {
                mqttClient.disconnect();
                mqttClient.close();
                log.info("✅ MQTT client disconnected successfully");
            }
        } catch (MqttException e) {
            log.error("❌ Error during MQTT cleanup", e);
        }
    }
}

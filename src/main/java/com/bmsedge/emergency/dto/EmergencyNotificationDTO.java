package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.enums.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyNotificationDTO {
    private NotificationType type;
    private Object payload;       // Entity snapshot or a small map
    private LocalDateTime timestamp;
}

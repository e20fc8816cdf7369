package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.AlertDeliveryStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertRecord {

    private String channelId;
    private String channelName;
    private String message;
    private Integer delaySeconds;
    private AlertDeliveryStatus status;

    // Contact notifications only
    private String contactId;
    private String contactName;
    private String contactNumber;

    private LocalDateTime sentAt;
}

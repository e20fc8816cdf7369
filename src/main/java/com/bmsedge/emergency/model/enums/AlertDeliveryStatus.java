package com.bmsedge.emergency.model.enums;

public enum AlertDeliveryStatus {
    SENT,
    NOTIFIED,
    AUTO_CALLED
}

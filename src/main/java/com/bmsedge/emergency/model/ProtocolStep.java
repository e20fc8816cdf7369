package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.ProtocolActionKind;
import lombok.Builder;
import lombok.Value;

/**
 * One response protocol action: a kind interpreted by the protocol executor,
 * a human-readable description and an optional kind-specific parameter
 * (supply name, phone number, display text).
 */
@Value
@Builder
public class ProtocolStep {

    ProtocolActionKind kind;
    String description;
    String parameter;

    public static ProtocolStep of(ProtocolActionKind kind, String description) {
        return new ProtocolStep(kind, description, null);
    }

    public static ProtocolStep of(ProtocolActionKind kind, String description, String parameter) {
        return new ProtocolStep(kind, description, parameter);
    }
}

package world.willfrog.sentinel.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskLevel fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return RiskLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package world.willfrog.sentinel.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 分诊结束后建议的处置动作，对外以 snake_case 传输。
 */
public enum RecommendedAction {
    FREEZE_CARD,
    OPEN_DISPUTE,
    CONTACT_CUSTOMER,
    MARK_FALSE_POSITIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析外部传入的动作名，无法识别时返回 null。
     */
    @JsonCreator
    public static RecommendedAction fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return RecommendedAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

package world.willfrog.sentinel.triage.model;

import java.util.Locale;

public enum AlertStatus {
    OPEN,
    RESOLVED,
    DISPUTED,
    PENDING_CUSTOMER,
    FALSE_POSITIVE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 动作执行后告警应进入的状态；未知动作按已解决处理。
     *
     * @param actionType 动作名（snake_case）
     * @return 目标状态
     */
    public static AlertStatus afterAction(String actionType) {
        RecommendedAction action = RecommendedAction.fromWireName(actionType);
        if (action == null) {
            return RESOLVED;
        }
        return switch (action) {
            case FREEZE_CARD -> RESOLVED;
            case OPEN_DISPUTE -> DISPUTED;
            case CONTACT_CUSTOMER -> PENDING_CUSTOMER;
            case MARK_FALSE_POSITIVE -> FALSE_POSITIVE;
        };
    }
}

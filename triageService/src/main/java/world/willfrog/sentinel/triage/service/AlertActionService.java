package world.willfrog.sentinel.triage.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.sentinel.common.dto.ResponseCode;
import world.willfrog.sentinel.common.pojo.triage.Alert;
import world.willfrog.sentinel.triage.exception.BizException;
import world.willfrog.sentinel.triage.mapper.AlertMapper;
import world.willfrog.sentinel.triage.model.AlertActionResult;
import world.willfrog.sentinel.triage.model.AlertStatus;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 处置动作执行后同步告警状态。
 * <p>
 * 动作到状态的映射见 {@link AlertStatus#afterAction(String)}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertActionService {

    private final AlertMapper alertMapper;
    private final Clock clock;

    public AlertActionResult executeActionAndUpdateAlert(String alertId, String actionType, Map<String, Object> actionParams) {
        Alert alert = alertMapper.findAggregateById(alertId);
        if (alert == null) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "Alert " + alertId + " not found");
        }
        AlertStatus newStatus = AlertStatus.afterAction(actionType);
        Map<String, Object> params = actionParams == null ? new LinkedHashMap<>() : new LinkedHashMap<>(actionParams);
        AlertActionResult.ActionRecord record = new AlertActionResult.ActionRecord(actionType, params, OffsetDateTime.now(clock));

        alertMapper.updateStatus(alertId, newStatus.wireName());
        log.info("Action executed and alert updated: alertId={}, actionType={}, newStatus={}",
                alertId, actionType, newStatus.wireName());

        return AlertActionResult.builder()
                .alertId(alertId)
                .actionType(actionType)
                .alertStatus(newStatus.wireName())
                .actionResult(record)
                .build();
    }

    /**
     * 只更新告警状态。失败只记日志，不向调用方抛出。
     */
    public void updateAlertStatusAfterAction(String alertId, String actionType) {
        AlertStatus newStatus = AlertStatus.afterAction(actionType);
        try {
            int updated = alertMapper.updateStatus(alertId, newStatus.wireName());
            if (updated == 0) {
                log.warn("Alert status not updated, alert missing: alertId={}, actionType={}", alertId, actionType);
                return;
            }
            log.info("Alert status updated after action: alertId={}, actionType={}, newStatus={}",
                    alertId, actionType, newStatus.wireName());
        } catch (RuntimeException e) {
            log.error("Update alert status failed: alertId={}, actionType={}", alertId, actionType, e);
        }
    }
}

package world.willfrog.sentinel.triage.exception;

import lombok.Getter;
import world.willfrog.sentinel.common.dto.ResponseCode;

/**
 * 业务异常：在分诊开始前或接口层直接终止，不进入步骤的降级通道。
 */
@Getter
public class BizException extends RuntimeException {
    private final ResponseCode code;

    public BizException(ResponseCode code, String message) {
        super(message);
        this.code = code;
    }
}

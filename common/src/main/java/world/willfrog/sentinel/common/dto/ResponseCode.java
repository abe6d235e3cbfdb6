package world.willfrog.sentinel.common.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 统一响应状态码枚举
 */
@Getter
@AllArgsConstructor
public enum ResponseCode {

    /**
     * 成功响应
     */
    SUCCESS("200", "成功"),

    /**
     * 参数错误
     */
    PARAM_ERROR("400", "参数错误"),

    /**
     * 数据未找到
     */
    DATA_NOT_FOUND("404", "数据未找到"),

    /**
     * 系统内部错误
     */
    SYSTEM_ERROR("500", "系统内部错误");

    /**
     * 状态码
     */
    private final String code;

    /**
     * 状态消息
     */
    private final String message;
}

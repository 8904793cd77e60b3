package com.trippy.common.result;

/**
 * 错误码枚举。
 * <p>推荐链路本身不抛业务异常（冷启动、外部依赖失败都会降级为空结果），这里只覆盖入参与数据访问类错误。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 请求参数不合法（userId / destination 为空等） */
    INVALID_PARAM(1001, "请求参数不合法"),

    /** 滑动操作缺少物品 ID */
    SWIPE_ITEM_MISSING(1002, "itemId 不能为空"),

    /** 多人推荐缺少参与者 */
    PARTICIPANTS_MISSING(1003, "参与者列表不能为空"),

    /** 数据访问失败 */
    DATA_ACCESS_ERROR(2001, "数据库操作异常");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}

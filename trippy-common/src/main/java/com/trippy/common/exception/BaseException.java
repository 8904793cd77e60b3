package com.trippy.common.exception;

import com.trippy.common.result.ErrorCode;

/**
 * 统一的业务异常类型，由全局异常处理器转换为错误响应。
 * <p>只用于入参不合法等预期内错误；推荐链路中的外部依赖失败不走这里，而是在协作方边界降级。</p>
 */
public class BaseException extends RuntimeException {

    private final Integer code;

    public BaseException(String message) {
        super(message);
        this.code = ErrorCode.COMMON_ERROR.getCode();
    }

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.code = errorCode.getCode();
    }

    public BaseException(String message, Throwable cause) {
        super(message, cause);
        this.code = ErrorCode.COMMON_ERROR.getCode();
    }

    public Integer getCode() {
        return code;
    }
}

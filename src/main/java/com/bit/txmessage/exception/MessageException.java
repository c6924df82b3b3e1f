package com.bit.txmessage.exception;

/**
 * 消息编译层异常：统一封装错误类型、出错的值与错误信息，调用方无需了解内部状态即可定位问题
 */
public class MessageException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    // 出错的值（如缺失的公钥Base58、非法的区块哈希），可能为null
    private final String offendingValue;

    public MessageException(ErrorType errorType, String message) {
        this(errorType, message, null);
    }

    public MessageException(ErrorType errorType, String message, String offendingValue) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
        this.offendingValue = offendingValue;
    }

    // 构造方法：带cause异常（链式追踪）
    public MessageException(ErrorType errorType, String message, String offendingValue, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
        this.offendingValue = offendingValue;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getOffendingValue() {
        return offendingValue;
    }
}

package com.bit.txmessage.exception;

public enum ErrorType {
    MISSING_BLOCKHASH_OR_NONCE("缺少最近区块哈希或nonce信息"),
    NO_INSTRUCTIONS("交易中没有任何指令"),
    MISSING_FEE_PAYER("未设置费用支付者"),
    INVALID_BLOCKHASH("区块哈希无效（Base58解码后必须为32字节）"),
    ACCOUNT_INDEX_OVERFLOW("账户索引溢出（账户表最多256个账户）"),
    ACCOUNT_NOT_FOUND("账户不在账户表中（内部一致性错误）"),
    HEADER_COUNT_OVERFLOW("消息头计数溢出（单字节最大255）"),
    MALFORMED_COMPACT_LENGTH("变长长度编码格式错误（续位序列被截断）"),
    MALFORMED_MESSAGE("消息字节格式错误（长度不足或存在多余字节）");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}

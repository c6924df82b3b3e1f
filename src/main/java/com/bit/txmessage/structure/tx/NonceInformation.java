package com.bit.txmessage.structure.tx;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Durable nonce信息：用链上nonce值代替最近区块哈希，使交易可以延迟提交
 * 构建消息时advance指令会被放在第一条执行
 */
@Getter
@ToString
@AllArgsConstructor
public class NonceInformation {

    /**
     * 当前nonce值（Base58），作为消息中的recent blockhash
     */
    private final String nonce;

    /**
     * 推进nonce的指令（AdvanceNonceAccount）
     */
    private final Instruction instruction;
}

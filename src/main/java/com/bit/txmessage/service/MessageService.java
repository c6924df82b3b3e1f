package com.bit.txmessage.service;

import com.bit.txmessage.common.Pubkey;
import com.bit.txmessage.structure.tx.Instruction;
import com.bit.txmessage.structure.tx.Message;
import com.bit.txmessage.structure.tx.NonceInformation;

import java.util.List;

public interface MessageService {

    /**
     * 使用最近区块哈希编译消息
     */
    byte[] compileMessage(Pubkey feePayer, String recentBlockHash, List<Instruction> instructions);

    /**
     * 使用durable nonce编译消息，advance指令排在第一条
     */
    byte[] compileMessage(Pubkey feePayer, NonceInformation nonceInformation, List<Instruction> instructions);

    Message decodeMessage(byte[] data);

    /**
     * 解析后按原账户顺序重新编译
     */
    byte[] recompile(byte[] data);

    /**
     * 签名后交易的字节数：签名数量(变长) + 签名 + 消息
     */
    int signedTransactionSize(byte[] message);
}

package com.bit.txmessage.builder;

import com.bit.txmessage.common.Pubkey;
import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import com.bit.txmessage.structure.account.AccountMeta;
import com.bit.txmessage.structure.tx.CompiledInstruction;
import com.bit.txmessage.structure.tx.Instruction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 将指令编译为基于账户表索引的形式
 * 账户表在构造时固定，索引查找基于该快照
 */
class InstructionCompiler {

    /**
     * 索引必须放进1个字节
     */
    static final int MAX_ACCOUNTS = 256;

    private final Map<Pubkey, Integer> indexes;

    InstructionCompiler(List<AccountMeta> accounts) {
        this.indexes = new HashMap<>(accounts.size() * 2);
        for (int i = 0; i < accounts.size(); i++) {
            indexes.putIfAbsent(accounts.get(i).getPubkey(), i);
        }
    }

    CompiledInstruction compile(Instruction instruction) {
        List<AccountMeta> keys = instruction.getKeys();
        byte[] keyIndices = new byte[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            keyIndices[i] = findAccountIndex(keys.get(i).getPubkey());
        }
        int programIdIndex = findAccountIndex(instruction.getProgramId()) & 0xFF;
        return new CompiledInstruction(programIdIndex, keyIndices, instruction.getData());
    }

    byte findAccountIndex(Pubkey pubkey) {
        Integer index = indexes.get(pubkey);
        if (index == null) {
            throw new MessageException(ErrorType.ACCOUNT_NOT_FOUND,
                    "账户`" + pubkey + "`不在账户表中，编译交易时出现内部错误", pubkey.toBase58());
        }
        if (index >= MAX_ACCOUNTS) {
            throw new MessageException(ErrorType.ACCOUNT_INDEX_OVERFLOW,
                    "账户`" + pubkey + "`的索引" + index + "无法用单字节表示", pubkey.toBase58());
        }
        return (byte) index.intValue();
    }
}

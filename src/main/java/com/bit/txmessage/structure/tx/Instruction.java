package com.bit.txmessage.structure.tx;

import com.bit.txmessage.common.Pubkey;
import com.bit.txmessage.structure.account.AccountMeta;
import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;

/**
 * 交易指令，定义具体要执行的操作（如转账、调用合约方法）
 * 由指定的程序（智能合约）处理
 */
@Getter
@ToString(exclude = "data")
@EqualsAndHashCode
public class Instruction {

    /**
     * 程序ID（32字节，即智能合约的地址）
     * 标识处理该指令的智能合约（如系统程序、代币程序）
     */
    private final Pubkey programId;

    /**
     * 指令涉及的账户（允许重复，顺序决定编译后的索引顺序）
     */
    private final List<AccountMeta> keys;

    /**
     * 指令数据（字节数组）
     * 格式由programId对应的程序定义，这里不做解析
     */
    private final byte[] data;

    public Instruction(Pubkey programId, List<AccountMeta> keys, byte[] data) {
        if (programId == null) {
            throw new NullPointerException("程序ID不能为null");
        }
        this.programId = programId;
        this.keys = keys == null ? ImmutableList.of() : ImmutableList.copyOf(keys);
        this.data = data == null ? new byte[0] : Arrays.copyOf(data, data.length);
    }

    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }
}

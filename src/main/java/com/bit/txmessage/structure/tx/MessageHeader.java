package com.bit.txmessage.structure.tx;

import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import com.bit.txmessage.structure.account.AccountMeta;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 消息头（3字节），由最终账户表推导，不直接设置
 * 格式：[需要的签名数量(1字节)] + [只读签名账户数量(1字节)] + [只读非签名账户数量(1字节)]
 */
@Data
@AllArgsConstructor
public class MessageHeader {

    public static final int HEADER_LENGTH = 3;

    private static final int MAX_COUNT = 0xFF;

    /**
     * 需要的签名数量：账户表中签名账户的个数
     */
    private final int numRequiredSignatures;

    /**
     * 签名账户中只读账户的个数
     */
    private final int numReadonlySignedAccounts;

    /**
     * 非签名账户中只读账户的个数
     */
    private final int numReadonlyUnsignedAccounts;

    /**
     * 根据最终账户表统计消息头
     * @throws MessageException HEADER_COUNT_OVERFLOW：任一计数超过255
     */
    public static MessageHeader compute(List<AccountMeta> accounts) {
        int required = 0;
        int readonlySigned = 0;
        int readonlyUnsigned = 0;
        for (AccountMeta account : accounts) {
            if (account.isSigner()) {
                required++;
                if (!account.isWritable()) {
                    readonlySigned++;
                }
            } else if (!account.isWritable()) {
                readonlyUnsigned++;
            }
        }
        checkCount("numRequiredSignatures", required);
        checkCount("numReadonlySignedAccounts", readonlySigned);
        checkCount("numReadonlyUnsignedAccounts", readonlyUnsigned);
        return new MessageHeader(required, readonlySigned, readonlyUnsigned);
    }

    public static MessageHeader fromBytes(byte[] data, int offset) {
        return new MessageHeader(data[offset] & 0xFF, data[offset + 1] & 0xFF, data[offset + 2] & 0xFF);
    }

    public byte[] toBytes() {
        return new byte[]{
                (byte) numRequiredSignatures,
                (byte) numReadonlySignedAccounts,
                (byte) numReadonlyUnsignedAccounts
        };
    }

    private static void checkCount(String name, int count) {
        if (count > MAX_COUNT) {
            throw new MessageException(ErrorType.HEADER_COUNT_OVERFLOW,
                    name + "=" + count + "，超过单字节上限" + MAX_COUNT, String.valueOf(count));
        }
    }
}

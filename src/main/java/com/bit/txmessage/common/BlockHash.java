package com.bit.txmessage.common;

import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

/**
 * 区块哈希（32字节），作为消息中的最近区块哈希（或durable nonce值）
 */
public class BlockHash extends ByteHash32 {

    public static final BlockHash ZERO = new BlockHash(new byte[HASH_LENGTH]);

    public BlockHash(byte[] value) {
        super(value);
    }

    public static BlockHash fromBytes(byte[] bytes) {
        return new BlockHash(bytes);
    }

    /**
     * 从Base58字符串创建BlockHash
     * @throws MessageException INVALID_BLOCKHASH：非法字符或解码结果不是32字节
     */
    public static BlockHash fromBase58(String base58) {
        if (base58 == null) {
            throw new MessageException(ErrorType.INVALID_BLOCKHASH, "区块哈希不能为null");
        }
        byte[] decoded;
        try {
            decoded = Base58.decode(base58);
        } catch (AddressFormatException e) {
            throw new MessageException(ErrorType.INVALID_BLOCKHASH,
                    "区块哈希包含非法Base58字符：" + base58, base58, e);
        }
        if (decoded.length != HASH_LENGTH) {
            throw new MessageException(ErrorType.INVALID_BLOCKHASH,
                    "区块哈希解码后为" + decoded.length + "字节，必须为" + HASH_LENGTH + "字节", base58);
        }
        return new BlockHash(decoded);
    }
}

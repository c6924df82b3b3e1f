package com.bit.txmessage.common;

import lombok.EqualsAndHashCode;
import org.bitcoinj.core.Base58;
import org.bouncycastle.util.encoders.Hex;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Solana中32字节哈希的通用基类，封装共同逻辑（长度校验、不可变性、转换方法等）
 * 具体哈希类型（如区块哈希、nonce值）应继承此类
 */
@EqualsAndHashCode(of = "value")
public abstract class ByteHash32 implements Serializable {
    public static final int HASH_LENGTH = 32;

    // 存储32字节哈希数据（私有且不可变）
    private final byte[] value;
    // 缓存Base58字符串（避免重复计算）
    private final String base58Value;

    /**
     * 构造方法，由子类调用，强制校验长度
     * @param value 32字节哈希的原始字节数组
     * @throws IllegalArgumentException 若长度不符
     */
    protected ByteHash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH);
        this.base58Value = Base58.encode(this.value);
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    public String toBase58() {
        return base58Value;
    }

    public String toHex() {
        return Hex.toHexString(value);
    }

    /**
     * 判断是否为零哈希（全0字节）
     */
    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return base58Value;
    }
}

package com.bit.txmessage.common;

import lombok.EqualsAndHashCode;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

import java.util.Arrays;

/**
 * 公钥封装（32字节），统一账户/程序的地址表示
 * 字符串形式为Base58编码
 */
@EqualsAndHashCode
public class Pubkey {
    public static final int LENGTH = 32;
    private final byte[] value;

    private Pubkey(byte[] value) {
        if (value == null) {
            throw new NullPointerException("公钥不能为null");
        }
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("公钥必须为32字节，实际为" + value.length + "字节");
        }
        this.value = value;
    }

    public static Pubkey fromBytes(byte[] bytes) {
        return new Pubkey(bytes == null ? null : Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * 从Base58字符串解析公钥
     * @throws IllegalArgumentException 非法字符或解码后不是32字节
     */
    public static Pubkey fromBase58(String base58) {
        try {
            return new Pubkey(Base58.decode(base58));
        } catch (AddressFormatException e) {
            throw new IllegalArgumentException("非法的Base58公钥：" + base58, e);
        }
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    public String toBase58() {
        return Base58.encode(value);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}

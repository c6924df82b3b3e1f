package com.bit.txmessage;

import com.bit.txmessage.common.Pubkey;

import java.util.Arrays;

/**
 * 测试用公钥：按编号生成互不相同的32字节公钥
 */
public final class TestKeys {

    private TestKeys() {
    }

    public static Pubkey key(int n) {
        byte[] bytes = new byte[Pubkey.LENGTH];
        Arrays.fill(bytes, (byte) 0x07);
        bytes[0] = (byte) (n >>> 8);
        bytes[1] = (byte) n;
        return Pubkey.fromBytes(bytes);
    }

    public static byte[] filled(int value) {
        byte[] bytes = new byte[Pubkey.LENGTH];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }
}

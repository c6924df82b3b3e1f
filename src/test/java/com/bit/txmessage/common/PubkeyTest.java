package com.bit.txmessage.common;

import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import org.junit.jupiter.api.Test;

import static com.bit.txmessage.TestKeys.filled;
import static org.junit.jupiter.api.Assertions.*;

public class PubkeyTest {

    // 系统程序地址
    private static final String SYSTEM_PROGRAM = "11111111111111111111111111111111";

    @Test
    void testBase58() {
        Pubkey system = Pubkey.fromBase58(SYSTEM_PROGRAM);
        assertArrayEquals(new byte[32], system.toBytes());
        assertEquals(SYSTEM_PROGRAM, system.toString());

        Pubkey key = Pubkey.fromBytes(filled(0x5A));
        assertEquals(key, Pubkey.fromBase58(key.toBase58()));
        assertEquals(key.hashCode(), Pubkey.fromBytes(filled(0x5A)).hashCode());
    }

    @Test
    void testInvalidPubkey() {
        assertThrows(IllegalArgumentException.class, () -> Pubkey.fromBytes(new byte[31]));
        assertThrows(IllegalArgumentException.class, () -> Pubkey.fromBase58("1111"));
        assertThrows(IllegalArgumentException.class, () -> Pubkey.fromBase58("0OIl"));
    }

    @Test
    void testDefensiveCopy() {
        byte[] bytes = filled(1);
        Pubkey key = Pubkey.fromBytes(bytes);
        bytes[0] = 9;
        key.toBytes()[1] = 9;
        assertArrayEquals(filled(1), key.toBytes());
    }

    @Test
    void testBlockHash() {
        BlockHash hash = BlockHash.fromBase58(BlockHash.ZERO.toBase58());
        assertTrue(hash.isZero());
        assertEquals(BlockHash.ZERO, hash);
        assertEquals("0101010101010101010101010101010101010101010101010101010101010101",
                BlockHash.fromBytes(filled(1)).toHex());

        MessageException e = assertThrows(MessageException.class, () -> BlockHash.fromBase58(null));
        assertEquals(ErrorType.INVALID_BLOCKHASH, e.getErrorType());
        e = assertThrows(MessageException.class, () -> BlockHash.fromBase58("abc"));
        assertEquals(ErrorType.INVALID_BLOCKHASH, e.getErrorType());
        assertEquals("abc", e.getOffendingValue());
    }
}

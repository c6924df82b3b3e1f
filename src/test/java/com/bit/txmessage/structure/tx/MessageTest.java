package com.bit.txmessage.structure.tx;

import com.bit.txmessage.common.BlockHash;
import com.bit.txmessage.common.Pubkey;
import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.bit.txmessage.TestKeys.filled;
import static com.bit.txmessage.TestKeys.key;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class MessageTest {

    private static Message sample() {
        // 账户：[付款方(签名可写), 只读签名, 可写, 程序(只读)]
        List<Pubkey> keys = List.of(key(1), key(2), key(3), key(4));
        CompiledInstruction instruction = new CompiledInstruction(3, new byte[]{0, 2, 1}, new byte[]{9, 8, 7});
        return new Message(new MessageHeader(2, 1, 1), keys, BlockHash.fromBytes(filled(5)), List.of(instruction));
    }

    @Test
    void testProgramIdIndexRange() {
        assertThrows(IllegalArgumentException.class, () -> new CompiledInstruction(-1, new byte[0], new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new CompiledInstruction(256, new byte[0], new byte[0]));
        CompiledInstruction last = new CompiledInstruction(255, new byte[]{0}, new byte[0]);
        assertEquals(255, last.getProgramIdIndex());
    }

    @Test
    void testSerializeLayout() {
        byte[] bytes = sample().serialize();
        assertEquals(3 + 1 + 4 * 32 + 32 + 1 + (1 + 1 + 3 + 1 + 3), bytes.length);
        assertArrayEquals(new byte[]{2, 1, 1, 4}, Arrays.copyOfRange(bytes, 0, 4));
        assertArrayEquals(key(1).toBytes(), Arrays.copyOfRange(bytes, 4, 36));
        assertArrayEquals(filled(5), Arrays.copyOfRange(bytes, 132, 164));
        assertArrayEquals(new byte[]{1, 3, 3, 0, 2, 1, 3, 9, 8, 7}, Arrays.copyOfRange(bytes, 164, bytes.length));
    }

    @Test
    void testDeserialize() {
        Message original = sample();
        Message decoded = Message.deserialize(original.serialize());

        assertEquals(original.getHeader(), decoded.getHeader());
        assertEquals(original.getAccountKeys(), decoded.getAccountKeys());
        assertEquals(original.getRecentBlockhash(), decoded.getRecentBlockhash());
        assertEquals(1, decoded.getInstructions().size());
        CompiledInstruction instruction = decoded.getInstructions().get(0);
        assertEquals(3, instruction.getProgramIdIndex());
        assertArrayEquals(new byte[]{0, 2, 1}, instruction.getKeyIndices());
        assertArrayEquals(new byte[]{9, 8, 7}, instruction.getData());
        assertEquals(key(1), decoded.getFeePayer());
    }

    @Test
    void testAccountFlagsFromHeader() {
        Message message = sample();
        assertTrue(message.isAccountSigner(0));
        assertTrue(message.isAccountWritable(0));
        assertTrue(message.isAccountSigner(1));
        assertFalse(message.isAccountWritable(1));
        assertFalse(message.isAccountSigner(2));
        assertTrue(message.isAccountWritable(2));
        assertFalse(message.isAccountSigner(3));
        assertFalse(message.isAccountWritable(3));
    }

    @Test
    void testDeserializeTruncated() {
        byte[] bytes = sample().serialize();
        for (int cut : new int[]{0, 2, 10, 140, bytes.length - 1}) {
            MessageException e = assertThrows(MessageException.class,
                    () -> Message.deserialize(Arrays.copyOf(bytes, cut)));
            assertTrue(e.getErrorType() == ErrorType.MALFORMED_MESSAGE
                    || e.getErrorType() == ErrorType.MALFORMED_COMPACT_LENGTH);
            log.info("截断到{}字节：{}", cut, e.getMessage());
        }
    }

    @Test
    void testDeserializeTrailingBytes() {
        byte[] bytes = sample().serialize();
        MessageException e = assertThrows(MessageException.class,
                () -> Message.deserialize(Arrays.copyOf(bytes, bytes.length + 1)));
        assertEquals(ErrorType.MALFORMED_MESSAGE, e.getErrorType());
    }

    @Test
    void testDeserializeIndexOutOfRange() {
        List<Pubkey> keys = List.of(key(1), key(2));
        CompiledInstruction instruction = new CompiledInstruction(1, new byte[]{5}, new byte[0]);
        byte[] bytes = new Message(new MessageHeader(1, 0, 1), keys, BlockHash.ZERO, List.of(instruction)).serialize();

        MessageException e = assertThrows(MessageException.class, () -> Message.deserialize(bytes));
        assertEquals(ErrorType.MALFORMED_MESSAGE, e.getErrorType());
        assertEquals("5", e.getOffendingValue());
    }

    @Test
    void testDeserializeInconsistentHeader() {
        byte[] bytes = sample().serialize();
        bytes[0] = 5;
        MessageException e = assertThrows(MessageException.class, () -> Message.deserialize(bytes));
        assertEquals(ErrorType.MALFORMED_MESSAGE, e.getErrorType());
    }
}

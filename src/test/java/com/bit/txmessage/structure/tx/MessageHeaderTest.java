package com.bit.txmessage.structure.tx;

import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import com.bit.txmessage.structure.account.AccountMeta;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.bit.txmessage.TestKeys.key;
import static org.junit.jupiter.api.Assertions.*;

public class MessageHeaderTest {

    @Test
    void testCompute() {
        List<AccountMeta> accounts = List.of(
                AccountMeta.writable(key(1), true),
                AccountMeta.readOnly(key(2), true),
                AccountMeta.readOnly(key(3), true),
                AccountMeta.writable(key(4), false),
                AccountMeta.readOnly(key(5), false));
        MessageHeader header = MessageHeader.compute(accounts);

        assertEquals(3, header.getNumRequiredSignatures());
        assertEquals(2, header.getNumReadonlySignedAccounts());
        assertEquals(1, header.getNumReadonlyUnsignedAccounts());
        assertArrayEquals(new byte[]{3, 2, 1}, header.toBytes());
    }

    @Test
    void testEmptyTable() {
        assertArrayEquals(new byte[]{0, 0, 0}, MessageHeader.compute(List.of()).toBytes());
    }

    @Test
    void testFromBytes() {
        MessageHeader header = MessageHeader.fromBytes(new byte[]{9, (byte) 200, 1, 0}, 1);
        assertEquals(new MessageHeader(200, 1, 0), header);
    }

    @Test
    void testCountOverflow() {
        List<AccountMeta> accounts = new ArrayList<>();
        for (int i = 0; i < 256; i++) {
            accounts.add(AccountMeta.writable(key(i), true));
        }
        MessageException e = assertThrows(MessageException.class, () -> MessageHeader.compute(accounts));
        assertEquals(ErrorType.HEADER_COUNT_OVERFLOW, e.getErrorType());
        assertEquals("256", e.getOffendingValue());

        accounts.remove(0);
        assertEquals(255, MessageHeader.compute(accounts).getNumRequiredSignatures());
    }
}

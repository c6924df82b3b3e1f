package com.bit.txmessage.structure.tx;

import com.bit.txmessage.common.BlockHash;
import com.bit.txmessage.common.Pubkey;
import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import com.bit.txmessage.util.ShortVecEncoding;
import com.bit.txmessage.util.ShortVecEncoding.DecodedLength;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;

/**
 * 交易消息（签名数据），构建完成后不可变
 * 线格式（无填充，整体无长度前缀）：
 * [消息头 3字节]
 * [账户数量(变长)] + [账户数量 × 32字节公钥]
 * [最近区块哈希 32字节]
 * [指令数量(变长)] + [编译后的指令...]
 */
@Getter
@ToString
public class Message {

    private final MessageHeader header;

    /**
     * 账户表（按最终顺序），前 numRequiredSignatures 个为签名账户
     */
    private final List<Pubkey> accountKeys;

    private final BlockHash recentBlockhash;

    private final List<CompiledInstruction> instructions;

    public Message(MessageHeader header, List<Pubkey> accountKeys, BlockHash recentBlockhash,
                   List<CompiledInstruction> instructions) {
        this.header = header;
        this.accountKeys = ImmutableList.copyOf(accountKeys);
        this.recentBlockhash = recentBlockhash;
        this.instructions = ImmutableList.copyOf(instructions);
    }

    /**
     * 费用支付者：账户表第一个账户
     */
    public Pubkey getFeePayer() {
        return accountKeys.isEmpty() ? null : accountKeys.get(0);
    }

    public boolean isAccountSigner(int index) {
        return index < header.getNumRequiredSignatures();
    }

    public boolean isAccountWritable(int index) {
        int numSigned = header.getNumRequiredSignatures();
        if (index < numSigned) {
            return index < numSigned - header.getNumReadonlySignedAccounts();
        }
        return index < accountKeys.size() - header.getNumReadonlyUnsignedAccounts();
    }

    public byte[] serialize() {
        byte[] accountCount = ShortVecEncoding.encodeLength(accountKeys.size());
        byte[] instructionCount = ShortVecEncoding.encodeLength(instructions.size());
        int size = MessageHeader.HEADER_LENGTH + accountCount.length + accountKeys.size() * Pubkey.LENGTH
                + BlockHash.HASH_LENGTH + instructionCount.length;
        for (CompiledInstruction instruction : instructions) {
            size += instruction.length();
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream(size);
        buffer.writeBytes(header.toBytes());
        buffer.writeBytes(accountCount);
        for (Pubkey key : accountKeys) {
            buffer.writeBytes(key.toBytes());
        }
        buffer.writeBytes(recentBlockhash.getBytes());
        buffer.writeBytes(instructionCount);
        for (CompiledInstruction instruction : instructions) {
            instruction.writeTo(buffer);
        }
        return buffer.toByteArray();
    }

    /**
     * 从线格式解析消息
     * @throws MessageException MALFORMED_MESSAGE / MALFORMED_COMPACT_LENGTH
     */
    public static Message deserialize(byte[] data) {
        if (data == null) {
            throw new MessageException(ErrorType.MALFORMED_MESSAGE, "消息字节不能为null");
        }
        Reader reader = new Reader(data);

        MessageHeader header = MessageHeader.fromBytes(reader.read(MessageHeader.HEADER_LENGTH), 0);

        int accountCount = reader.readLength();
        ImmutableList.Builder<Pubkey> keys = ImmutableList.builderWithExpectedSize(accountCount);
        for (int i = 0; i < accountCount; i++) {
            keys.add(Pubkey.fromBytes(reader.read(Pubkey.LENGTH)));
        }
        if (header.getNumRequiredSignatures() > accountCount
                || header.getNumReadonlySignedAccounts() > header.getNumRequiredSignatures()
                || header.getNumReadonlyUnsignedAccounts() > accountCount - header.getNumRequiredSignatures()) {
            throw new MessageException(ErrorType.MALFORMED_MESSAGE,
                    "消息头与账户数量不一致：" + header + "，账户数量" + accountCount);
        }

        BlockHash recentBlockhash = BlockHash.fromBytes(reader.read(BlockHash.HASH_LENGTH));

        int instructionCount = reader.readLength();
        ImmutableList.Builder<CompiledInstruction> instructions = ImmutableList.builderWithExpectedSize(instructionCount);
        for (int i = 0; i < instructionCount; i++) {
            int programIdIndex = reader.read(1)[0] & 0xFF;
            byte[] keyIndices = reader.read(reader.readLength());
            checkIndex(programIdIndex, accountCount);
            for (byte keyIndex : keyIndices) {
                checkIndex(keyIndex & 0xFF, accountCount);
            }
            byte[] instructionData = reader.read(reader.readLength());
            instructions.add(new CompiledInstruction(programIdIndex, keyIndices, instructionData));
        }

        if (reader.remaining() > 0) {
            throw new MessageException(ErrorType.MALFORMED_MESSAGE,
                    "消息末尾存在" + reader.remaining() + "个多余字节");
        }
        return new Message(header, keys.build(), recentBlockhash, instructions.build());
    }

    private static void checkIndex(int index, int accountCount) {
        if (index >= accountCount) {
            throw new MessageException(ErrorType.MALFORMED_MESSAGE,
                    "账户索引" + index + "超出账户表范围（" + accountCount + "）", String.valueOf(index));
        }
    }

    private static class Reader {
        private final byte[] data;
        private int offset;

        Reader(byte[] data) {
            this.data = data;
        }

        byte[] read(int length) {
            if (length > data.length - offset) {
                throw new MessageException(ErrorType.MALFORMED_MESSAGE,
                        "偏移量" + offset + "处需要" + length + "字节，剩余" + (data.length - offset) + "字节");
            }
            byte[] bytes = Arrays.copyOfRange(data, offset, offset + length);
            offset += length;
            return bytes;
        }

        int readLength() {
            DecodedLength decoded = ShortVecEncoding.decodeLength(data, offset);
            offset += decoded.getLength();
            return decoded.getValue();
        }

        int remaining() {
            return data.length - offset;
        }
    }
}

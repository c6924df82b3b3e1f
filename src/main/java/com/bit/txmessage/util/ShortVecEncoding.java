package com.bit.txmessage.util;

import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Solana风格的变长长度编码（compact-u16 / short_vec）
 * 编码规则：每个字节的最高位表示是否继续（1=有后续字节，0=结束），低7位表示数据，低位组在前
 * 用于账户数量、指令数量、账户索引数量、指令数据长度等向量长度前缀
 */
public class ShortVecEncoding {

    /**
     * 解码结果为int，第5个字节（位移28）只剩低3位可用
     */
    private static final int MAX_SHIFT = 28;

    private ShortVecEncoding() {
    }

    /**
     * 编码长度
     * 0..127 -> 1字节，128..16383 -> 2字节，16384..65535 -> 3字节
     */
    public static byte[] encodeLength(int len) {
        if (len < 0) {
            throw new IllegalArgumentException("变长整数不能为负数：" + len);
        }
        byte[] out = new byte[10];
        int remLen = len;
        int cursor = 0;
        while (true) {
            int elem = remLen & 0x7F;
            remLen >>>= 7;
            if (remLen == 0) {
                out[cursor++] = (byte) elem;
                break;
            }
            out[cursor++] = (byte) (elem | 0x80);
        }
        byte[] bytes = new byte[cursor];
        System.arraycopy(out, 0, bytes, 0, cursor);
        return bytes;
    }

    /**
     * 从 offset 处解码一个长度
     *
     * @return 解码值与消耗的字节数
     * @throws MessageException 续位序列被截断或超出int范围
     */
    public static DecodedLength decodeLength(byte[] data, int offset) {
        int value = 0;
        int size = 0;
        while (true) {
            if (offset + size >= data.length) {
                throw new MessageException(ErrorType.MALFORMED_COMPACT_LENGTH,
                        "偏移量" + offset + "处的长度编码在第" + (size + 1) + "个字节处被截断",
                        String.valueOf(offset));
            }
            int elem = data[offset + size] & 0xFF;
            int shift = size * 7;
            if (shift > MAX_SHIFT || (shift == MAX_SHIFT && (elem & 0x7F) > 0x07)) {
                throw new MessageException(ErrorType.MALFORMED_COMPACT_LENGTH,
                        "偏移量" + offset + "处的长度编码超出int范围", String.valueOf(offset));
            }
            value |= (elem & 0x7F) << shift;
            size++;
            if ((elem & 0x80) == 0) {
                break;
            }
        }
        return new DecodedLength(value, size);
    }

    @Getter
    @AllArgsConstructor
    public static class DecodedLength {
        private final int value;
        // 消耗的字节数
        private final int length;
    }
}

package com.bit.txmessage.structure.tx;

import com.bit.txmessage.util.ShortVecEncoding;
import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.ToString;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * 编译后的指令：账户以账户表中的索引表示
 * 格式：[程序ID索引(1字节)] + [索引数量(变长)] + [索引(各1字节)] + [数据长度(变长)] + [数据]
 */
@Getter
@ToString
public class CompiledInstruction {

    private final int programIdIndex;

    private final byte[] keyIndices;

    private final byte[] data;

    public CompiledInstruction(int programIdIndex, byte[] keyIndices, byte[] data) {
        Preconditions.checkArgument(programIdIndex >= 0 && programIdIndex <= 0xFF,
                "程序ID索引必须在0..255之间：%s", programIdIndex);
        this.programIdIndex = programIdIndex;
        this.keyIndices = Arrays.copyOf(keyIndices, keyIndices.length);
        this.data = Arrays.copyOf(data, data.length);
    }

    public byte[] getKeyIndices() {
        return Arrays.copyOf(keyIndices, keyIndices.length);
    }

    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * 序列化后的字节数
     */
    public int length() {
        return 1 + ShortVecEncoding.encodeLength(keyIndices.length).length + keyIndices.length
                + ShortVecEncoding.encodeLength(data.length).length + data.length;
    }

    public void writeTo(ByteArrayOutputStream out) {
        out.write(programIdIndex);
        out.writeBytes(ShortVecEncoding.encodeLength(keyIndices.length));
        out.writeBytes(keyIndices);
        out.writeBytes(ShortVecEncoding.encodeLength(data.length));
        out.writeBytes(data);
    }
}

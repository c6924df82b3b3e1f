package com.bit.txmessage.service.impl;

import com.bit.txmessage.builder.MessageBuilder;
import com.bit.txmessage.common.Pubkey;
import com.bit.txmessage.config.MessageProperties;
import com.bit.txmessage.structure.tx.Instruction;
import com.bit.txmessage.structure.tx.Message;
import com.bit.txmessage.structure.tx.NonceInformation;
import com.bit.txmessage.service.MessageService;
import com.bit.txmessage.util.ShortVecEncoding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class MessageServiceImpl implements MessageService {

    @Autowired
    private MessageProperties properties;

    @Override
    public byte[] compileMessage(Pubkey feePayer, String recentBlockHash, List<Instruction> instructions) {
        MessageBuilder builder = new MessageBuilder()
                .setFeePayer(feePayer)
                .setRecentBlockHash(recentBlockHash)
                .addInstructions(instructions);
        return checkSize(builder.build());
    }

    @Override
    public byte[] compileMessage(Pubkey feePayer, NonceInformation nonceInformation, List<Instruction> instructions) {
        MessageBuilder builder = new MessageBuilder()
                .setFeePayer(feePayer)
                .setNonceInformation(nonceInformation)
                .addInstructions(instructions);
        return checkSize(builder.build());
    }

    @Override
    public Message decodeMessage(byte[] data) {
        return Message.deserialize(data);
    }

    @Override
    public byte[] recompile(byte[] data) {
        Message message = Message.deserialize(data);
        return checkSize(MessageBuilder.fromMessage(message).build());
    }

    @Override
    public int signedTransactionSize(byte[] message) {
        if (message == null || message.length < 3) {
            throw new IllegalArgumentException("消息字节不完整，至少需要3字节消息头");
        }
        int signatures = message[0] & 0xFF;
        return ShortVecEncoding.encodeLength(signatures).length
                + signatures * properties.getSignatureLength() + message.length;
    }

    private byte[] checkSize(byte[] message) {
        int size = signedTransactionSize(message);
        if (properties.isWarnOnOversize() && size > properties.getPacketDataSize()) {
            log.warn("签名后交易大小{}字节，超过网络包上限{}字节，提交时会被拒绝", size, properties.getPacketDataSize());
        } else {
            log.debug("消息{}字节，签名后{}字节", message.length, size);
        }
        return message;
    }
}

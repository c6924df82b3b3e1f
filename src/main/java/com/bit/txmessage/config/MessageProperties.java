package com.bit.txmessage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "message")
public class MessageProperties {
    private int packetDataSize = 1232;//网络包数据上限（字节），签名后的交易需放进一个包
    private boolean warnOnOversize = true;
    private int signatureLength = 64;
}

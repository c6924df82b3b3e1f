package com.bit.txmessage.structure.account;

import com.bit.txmessage.common.Pubkey;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 账户元数据，描述交易涉及的账户及其权限
 * 相等性只比较公钥，签名/可写标志可合并
 */
@Getter
@ToString
@EqualsAndHashCode(of = "pubkey")
public class AccountMeta {

    /**
     * 账户公钥（32字节）
     * 唯一标识区块链上的账户（如用户账户、程序账户）
     */
    private final Pubkey pubkey;

    /**
     * 是否为签名账户
     * true：该账户需在signatures列表中提供对应签名
     */
    private final boolean signer;

    /**
     * 是否为可写账户
     * 注：两笔交易修改同一可写账户会产生冲突，需串行执行
     */
    private final boolean writable;

    public AccountMeta(Pubkey pubkey, boolean signer, boolean writable) {
        if (pubkey == null) {
            throw new NullPointerException("账户公钥不能为null");
        }
        this.pubkey = pubkey;
        this.signer = signer;
        this.writable = writable;
    }

    public static AccountMeta writable(Pubkey pubkey, boolean signer) {
        return new AccountMeta(pubkey, signer, true);
    }

    public static AccountMeta readOnly(Pubkey pubkey, boolean signer) {
        return new AccountMeta(pubkey, signer, false);
    }

    /**
     * 合并同一账户的两次引用：签名与可写标志取或
     */
    public AccountMeta merge(AccountMeta other) {
        if (!pubkey.equals(other.pubkey)) {
            throw new IllegalArgumentException("只能合并同一公钥的账户元数据：" + pubkey + " / " + other.pubkey);
        }
        return new AccountMeta(pubkey, signer || other.signer, writable || other.writable);
    }
}

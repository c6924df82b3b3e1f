package com.bit.txmessage.structure.account;

import com.bit.txmessage.common.Pubkey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 账户合并表：按公钥去重并保持首次插入顺序
 * 同一公钥的重复引用合并为一条，签名/可写标志取或
 */
public class AccountKeysList {

    // 有序：序列化结果依赖稳定的迭代顺序
    private final LinkedHashMap<Pubkey, AccountMeta> accounts;

    public AccountKeysList() {
        this.accounts = new LinkedHashMap<>();
    }

    private AccountKeysList(Map<Pubkey, AccountMeta> accounts) {
        this.accounts = new LinkedHashMap<>(accounts);
    }

    public void add(AccountMeta accountMeta) {
        accounts.merge(accountMeta.getPubkey(), accountMeta, AccountMeta::merge);
    }

    public void addAll(Collection<AccountMeta> accountMetas) {
        for (AccountMeta accountMeta : accountMetas) {
            add(accountMeta);
        }
    }

    /**
     * 移除某个账户（丢弃已合并的标志）
     * @return 被移除的条目，不存在时为null
     */
    public AccountMeta remove(Pubkey pubkey) {
        return accounts.remove(pubkey);
    }

    public boolean contains(Pubkey pubkey) {
        return accounts.containsKey(pubkey);
    }

    public int size() {
        return accounts.size();
    }

    /**
     * 当前顺序的快照（拷贝，修改不影响本表）
     */
    public List<AccountMeta> snapshot() {
        return new ArrayList<>(accounts.values());
    }

    public AccountKeysList copy() {
        return new AccountKeysList(accounts);
    }
}

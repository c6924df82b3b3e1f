package com.bit.txmessage.builder;

import com.bit.txmessage.common.BlockHash;
import com.bit.txmessage.common.Pubkey;
import com.bit.txmessage.exception.ErrorType;
import com.bit.txmessage.exception.MessageException;
import com.bit.txmessage.structure.account.AccountKeysList;
import com.bit.txmessage.structure.account.AccountMeta;
import com.bit.txmessage.structure.tx.CompiledInstruction;
import com.bit.txmessage.structure.tx.Instruction;
import com.bit.txmessage.structure.tx.Message;
import com.bit.txmessage.structure.tx.MessageHeader;
import com.bit.txmessage.structure.tx.NonceInformation;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 交易消息构建器：累积指令、费用支付者、最近区块哈希/nonce，最终编译为线格式字节
 * 非线程安全，单一持有者使用；build() 不修改已累积的状态，重复调用结果一致
 */
@Slf4j
public class MessageBuilder {

    // 账户合并表（按指令添加顺序）
    private final AccountKeysList accountKeysList;

    @Getter
    private final List<Instruction> instructions;

    @Getter
    private String recentBlockHash;

    /**
     * 设置后优先于recentBlockHash
     */
    @Getter
    private NonceInformation nonceInformation;

    @Getter
    private Pubkey feePayer;

    /**
     * 反序列化得到的账户顺序，仅在重新序列化已有消息时设置，用于保持原有顺序
     */
    @Getter
    private List<Pubkey> accountKeys;

    public MessageBuilder() {
        this.accountKeysList = new AccountKeysList();
        this.instructions = new ArrayList<>();
    }

    /**
     * 添加一条指令：合并其账户及程序ID（只读、非签名）到账户表
     */
    public MessageBuilder addInstruction(Instruction instruction) {
        accountKeysList.addAll(instruction.getKeys());
        accountKeysList.add(AccountMeta.readOnly(instruction.getProgramId(), false));
        instructions.add(instruction);
        return this;
    }

    public MessageBuilder addInstructions(List<Instruction> instructions) {
        for (Instruction instruction : instructions) {
            addInstruction(instruction);
        }
        return this;
    }

    public MessageBuilder setFeePayer(Pubkey feePayer) {
        this.feePayer = feePayer;
        return this;
    }

    public MessageBuilder setRecentBlockHash(String recentBlockHash) {
        this.recentBlockHash = recentBlockHash;
        return this;
    }

    public MessageBuilder setRecentBlockHash(BlockHash recentBlockHash) {
        this.recentBlockHash = recentBlockHash == null ? null : recentBlockHash.toBase58();
        return this;
    }

    public MessageBuilder setNonceInformation(NonceInformation nonceInformation) {
        this.nonceInformation = nonceInformation;
        return this;
    }

    public MessageBuilder setAccountKeys(List<Pubkey> accountKeys) {
        this.accountKeys = accountKeys == null ? null : ImmutableList.copyOf(accountKeys);
        return this;
    }

    /**
     * 构建消息的线格式字节
     */
    public byte[] build() {
        return compileMessage().serialize();
    }

    /**
     * 编译消息：确定最终账户顺序、编译指令、统计消息头
     * @throws MessageException 输入不完整或账户表超出单字节索引范围
     */
    public Message compileMessage() {
        if (recentBlockHash == null && nonceInformation == null) {
            throw new MessageException(ErrorType.MISSING_BLOCKHASH_OR_NONCE, "构建消息需要最近区块哈希或nonce信息");
        }
        if (instructions.isEmpty()) {
            throw new MessageException(ErrorType.NO_INSTRUCTIONS, "交易中没有提供任何指令");
        }

        // 在副本上处理nonce，保证build()可重复调用
        String blockHash = recentBlockHash;
        AccountKeysList keysList = accountKeysList;
        List<Instruction> allInstructions = instructions;
        if (nonceInformation != null) {
            Instruction advance = nonceInformation.getInstruction();
            blockHash = nonceInformation.getNonce();
            keysList = new AccountKeysList();
            keysList.addAll(advance.getKeys());
            keysList.add(AccountMeta.readOnly(advance.getProgramId(), false));
            keysList.addAll(accountKeysList.snapshot());
            allInstructions = new ArrayList<>(instructions.size() + 1);
            allInstructions.add(advance);
            allInstructions.addAll(instructions);
        }

        List<AccountMeta> accounts = finalizeAccounts(keysList);
        if (accounts.size() > InstructionCompiler.MAX_ACCOUNTS) {
            throw new MessageException(ErrorType.ACCOUNT_INDEX_OVERFLOW,
                    "账户表共" + accounts.size() + "个账户，超过上限" + InstructionCompiler.MAX_ACCOUNTS,
                    String.valueOf(accounts.size()));
        }

        InstructionCompiler compiler = new InstructionCompiler(accounts);
        List<CompiledInstruction> compiledInstructions = new ArrayList<>(allInstructions.size());
        for (Instruction instruction : allInstructions) {
            compiledInstructions.add(compiler.compile(instruction));
        }

        MessageHeader header = MessageHeader.compute(accounts);
        BlockHash recentBlockhash = BlockHash.fromBase58(blockHash);

        List<Pubkey> keys = new ArrayList<>(accounts.size());
        for (AccountMeta account : accounts) {
            keys.add(account.getPubkey());
        }
        log.debug("消息编译完成：账户{}个，指令{}条，消息头{}", keys.size(), compiledInstructions.size(), header);
        return new Message(header, keys, recentBlockhash, compiledInstructions);
    }

    /**
     * 确定最终账户顺序：
     * 1. 费用支付者放在第一位，强制为签名+可写（丢弃之前合并的标志）
     * 2. 其余账户按 可写签名、只读签名、可写非签名、只读非签名 分组，组内保持插入顺序
     * 3. 若设置了原有顺序且包含所有账户，则其余账户按原有顺序排列
     */
    private List<AccountMeta> finalizeAccounts(AccountKeysList keysList) {
        if (feePayer == null) {
            throw new MessageException(ErrorType.MISSING_FEE_PAYER, "构建消息需要设置费用支付者");
        }
        AccountKeysList working = keysList.copy();
        working.remove(feePayer);

        List<AccountMeta> rest = working.snapshot();
        rest.sort(Comparator.comparingInt(MessageBuilder::accountClass));

        if (accountKeys != null) {
            Map<Pubkey, Integer> priorIndexes = new HashMap<>(accountKeys.size() * 2);
            for (int i = 0; i < accountKeys.size(); i++) {
                priorIndexes.putIfAbsent(accountKeys.get(i), i);
            }
            boolean allKnown = priorIndexes.containsKey(feePayer)
                    && rest.stream().allMatch(meta -> priorIndexes.containsKey(meta.getPubkey()));
            if (allKnown) {
                // 使用反序列化消息的账户顺序，费用支付者仍固定在第一位
                rest.sort(Comparator.comparingInt(meta -> priorIndexes.get(meta.getPubkey())));
            } else {
                log.debug("账户表包含原有顺序之外的账户，忽略原有顺序");
            }
        }

        List<AccountMeta> newList = new ArrayList<>(rest.size() + 1);
        newList.add(AccountMeta.writable(feePayer, true));
        newList.addAll(rest);
        return newList;
    }

    private static int accountClass(AccountMeta meta) {
        if (meta.isSigner()) {
            return meta.isWritable() ? 0 : 1;
        }
        return meta.isWritable() ? 2 : 3;
    }

    /**
     * 由已解析的消息还原构建器，保留原账户顺序，未修改时重新序列化结果与原字节一致
     */
    public static MessageBuilder fromMessage(Message message) {
        MessageBuilder builder = new MessageBuilder()
                .setFeePayer(message.getFeePayer())
                .setRecentBlockHash(message.getRecentBlockhash())
                .setAccountKeys(message.getAccountKeys());

        List<Pubkey> keys = message.getAccountKeys();
        for (CompiledInstruction compiled : message.getInstructions()) {
            byte[] keyIndices = compiled.getKeyIndices();
            List<AccountMeta> metas = new ArrayList<>(keyIndices.length);
            for (byte keyIndex : keyIndices) {
                int index = keyIndex & 0xFF;
                metas.add(new AccountMeta(keys.get(index),
                        message.isAccountSigner(index), message.isAccountWritable(index)));
            }
            builder.addInstruction(new Instruction(keys.get(compiled.getProgramIdIndex()), metas, compiled.getData()));
        }
        return builder;
    }
}

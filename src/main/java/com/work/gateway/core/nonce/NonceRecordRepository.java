package com.work.gateway.core.nonce;

import com.work.gateway.core.chain.ChainKey;

import java.util.List;
import java.util.Optional;

/**
 * NonceRecord 的持久化端口（跨重启保留），可由 MyBatis 或内存实现。
 */
public interface NonceRecordRepository {

    Optional<NonceRecord> find(ChainKey chain, String address);

    /**
     * 不存在则插入，存在则覆盖。调用方保证同一 (chain, address) 的写入已串行化。
     */
    void save(NonceRecord record);

    List<NonceRecord> listByChain(ChainKey chain);
}

package com.work.gateway.repository.impl;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.nonce.NonceRecord;
import com.work.gateway.core.nonce.NonceRecordRepository;
import com.work.gateway.repository.entity.NonceRecordEntity;
import com.work.gateway.repository.mapper.NonceRecordMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.gateway.core.support.ValidationUtils.requireNonEmpty;
import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 MyBatis-Plus 的 NonceRecordRepository 实现（H2 / PostgreSQL 通用 SQL）。
 * <p>
 * save 先 UPDATE、影响 0 行再 INSERT，不依赖数据库方言的 upsert；
 * 同一 (chain, address) 的写入已由 NonceManager 的临界区串行化。
 */
public class MybatisNonceRecordRepository implements NonceRecordRepository {

    private final NonceRecordMapper mapper;

    public MybatisNonceRecordRepository(NonceRecordMapper mapper) {
        this.mapper = requireNonNull(mapper, "mapper");
    }

    @Override
    public Optional<NonceRecord> find(ChainKey chain, String address) {
        requireNonNull(chain, "chain");
        requireNonEmpty(address, "address");
        return Optional.ofNullable(mapper.selectById(id(chain, address))).map(this::convert);
    }

    @Override
    public void save(NonceRecord record) {
        requireNonNull(record, "record");
        String id = id(record.getChain(), record.getAddress());
        int updated = mapper.updateRecord(id, record.getLastAllocated(), record.getSyncedAt());
        if (updated == 0) {
            mapper.insert(new NonceRecordEntity(id, record.getChain().getChain(), record.getChain().getNetwork(),
                    record.getAddress(), record.getLastAllocated(), record.getSyncedAt()));
        }
    }

    @Override
    public List<NonceRecord> listByChain(ChainKey chain) {
        requireNonNull(chain, "chain");
        List<NonceRecord> out = new ArrayList<>();
        for (NonceRecordEntity entity : mapper.selectByChain(chain.getChain(), chain.getNetwork())) {
            out.add(convert(entity));
        }
        return out;
    }

    private NonceRecord convert(NonceRecordEntity entity) {
        return new NonceRecord(ChainKey.of(entity.getChain(), entity.getNetwork()), entity.getAddress(),
                entity.getLastAllocated() == null ? NonceRecord.NONE : entity.getLastAllocated(),
                entity.getSyncedAt());
    }

    private static String id(ChainKey chain, String address) {
        return chain + "|" + address;
    }
}

package com.work.gateway.core.support;

import com.work.gateway.core.chain.ChainKey;
import com.work.gateway.core.nonce.NonceRecord;
import com.work.gateway.core.nonce.NonceRecordRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存实现，方便在没有数据库的环境下演示组件行为。
 * 注意：不具备跨重启持久性。
 */
public class InMemoryNonceRecordRepository implements NonceRecordRepository {

    private final Map<String, NonceRecord> table = new ConcurrentHashMap<>();

    @Override
    public Optional<NonceRecord> find(ChainKey chain, String address) {
        return Optional.ofNullable(table.get(key(chain, address)));
    }

    @Override
    public void save(NonceRecord record) {
        table.put(key(record.getChain(), record.getAddress()), record);
    }

    @Override
    public List<NonceRecord> listByChain(ChainKey chain) {
        List<NonceRecord> out = new ArrayList<>();
        for (NonceRecord r : table.values()) {
            if (r.getChain().equals(chain)) {
                out.add(r);
            }
        }
        return out;
    }

    private static String key(ChainKey chain, String address) {
        return chain + "|" + address;
    }
}

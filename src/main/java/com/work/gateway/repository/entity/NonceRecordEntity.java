package com.work.gateway.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * nonce_record 表实体类，主键为 "chain:network|address"。
 */
@TableName("nonce_record")
public class NonceRecordEntity {

    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    private String chain;

    private String network;

    private String address;

    private Long lastAllocated;

    private Instant syncedAt;

    public NonceRecordEntity() {
    }

    public NonceRecordEntity(String id, String chain, String network, String address, Long lastAllocated, Instant syncedAt) {
        this.id = id;
        this.chain = chain;
        this.network = network;
        this.address = address;
        this.lastAllocated = lastAllocated;
        this.syncedAt = syncedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getChain() {
        return chain;
    }

    public void setChain(String chain) {
        this.chain = chain;
    }

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Long getLastAllocated() {
        return lastAllocated;
    }

    public void setLastAllocated(Long lastAllocated) {
        this.lastAllocated = lastAllocated;
    }

    public Instant getSyncedAt() {
        return syncedAt;
    }

    public void setSyncedAt(Instant syncedAt) {
        this.syncedAt = syncedAt;
    }
}

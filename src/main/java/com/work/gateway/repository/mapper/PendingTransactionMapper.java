package com.work.gateway.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.gateway.repository.entity.PendingTransactionEntity;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

/**
 * pending_transaction 表 Mapper，SQL 见 mapper/PendingTransactionMapper.xml。
 */
public interface PendingTransactionMapper extends BaseMapper<PendingTransactionEntity> {

    /**
     * 同一 (chain, network, address, nonce) 下状态非 CONFIRMED / FAILED 的条目。
     */
    PendingTransactionEntity selectActiveByNonce(@Param("chain") String chain,
                                                 @Param("network") String network,
                                                 @Param("fromAddress") String fromAddress,
                                                 @Param("nonce") long nonce);

    List<PendingTransactionEntity> selectByChain(@Param("chain") String chain, @Param("network") String network);

    int updateStatus(@Param("id") String id,
                     @Param("status") String status,
                     @Param("updatedAt") Instant updatedAt);

    int deleteSubmittedBefore(@Param("cutoff") Instant cutoff);
}

package com.work.gateway.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.gateway.repository.entity.NonceRecordEntity;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

/**
 * nonce_record 表 Mapper，SQL 见 mapper/NonceRecordMapper.xml。
 */
public interface NonceRecordMapper extends BaseMapper<NonceRecordEntity> {

    List<NonceRecordEntity> selectByChain(@Param("chain") String chain, @Param("network") String network);

    /**
     * 覆盖 last_allocated / synced_at，返回影响行数（0 表示记录不存在）。
     */
    int updateRecord(@Param("id") String id,
                     @Param("lastAllocated") long lastAllocated,
                     @Param("syncedAt") Instant syncedAt);
}

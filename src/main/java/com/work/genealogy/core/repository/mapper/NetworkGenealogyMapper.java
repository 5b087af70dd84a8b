package com.work.genealogy.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.genealogy.core.repository.entity.NetworkGenealogyEntity;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

public interface NetworkGenealogyMapper extends BaseMapper<NetworkGenealogyEntity> {

    int insertGenealogy(@Param("id") String id,
                        @Param("ancestorId") String ancestorId,
                        @Param("descendantId") String descendantId,
                        @Param("createdAt") Instant createdAt);
}

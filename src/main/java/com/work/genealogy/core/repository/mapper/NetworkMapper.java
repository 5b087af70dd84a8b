package com.work.genealogy.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.genealogy.core.repository.entity.NetworkEntity;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface NetworkMapper extends BaseMapper<NetworkEntity> {

    NetworkEntity selectByNetworkRecordId(@Param("id") String id);

    int insertNetwork(@Param("id") String id,
                      @Param("networkId") String networkId,
                      @Param("name") String name,
                      @Param("historicBlockHash") String historicBlockHash,
                      @Param("historicBlockHeight") long historicBlockHeight,
                      @Param("createdAt") Instant createdAt);

    /**
     * 同链、更低高度，按高度倒序。
     */
    List<NetworkEntity> listPossibleAncestors(@Param("networkId") String networkId,
                                              @Param("height") long height,
                                              @Param("alreadyTried") Collection<String> alreadyTried,
                                              @Param("limit") int limit);

    /**
     * 同链、更高高度，按高度正序。
     */
    List<NetworkEntity> listPossibleDescendants(@Param("networkId") String networkId,
                                                @Param("height") long height,
                                                @Param("alreadyTried") Collection<String> alreadyTried,
                                                @Param("limit") int limit);
}

package com.work.genealogy.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * networks 表实体类。
 */
@TableName("networks")
public class NetworkEntity {

    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    private String networkId;

    private String name;

    private String historicBlockHash;

    private Long historicBlockHeight;

    private Instant createdAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getNetworkId() {
        return networkId;
    }

    public void setNetworkId(String networkId) {
        this.networkId = networkId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getHistoricBlockHash() {
        return historicBlockHash;
    }

    public void setHistoricBlockHash(String historicBlockHash) {
        this.historicBlockHash = historicBlockHash;
    }

    public Long getHistoricBlockHeight() {
        return historicBlockHeight;
    }

    public void setHistoricBlockHeight(Long historicBlockHeight) {
        this.historicBlockHeight = historicBlockHeight;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}

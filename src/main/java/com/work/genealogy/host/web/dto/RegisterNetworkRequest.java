package com.work.genealogy.host.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;

/**
 * 登记 network 请求（hash 可选，缺省时从链上读取）。
 */
public class RegisterNetworkRequest {

    @NotBlank(message = "networkId 不能为空")
    private String networkId;

    private String name;

    @NotNull(message = "height 不能为空")
    @PositiveOrZero(message = "height 不能为负数")
    private Long height;

    private String hash;

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

    public Long getHeight() {
        return height;
    }

    public void setHeight(Long height) {
        this.height = height;
    }

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }
}

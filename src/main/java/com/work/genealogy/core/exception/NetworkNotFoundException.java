package com.work.genealogy.core.exception;

/**
 * 引用的 network 记录不存在。属于调用方输入问题，重试无意义。
 */
public class NetworkNotFoundException extends GenealogyException {

    private final String networkRecordId;

    public NetworkNotFoundException(String networkRecordId) {
        super("network 不存在: " + networkRecordId);
        this.networkRecordId = networkRecordId;
    }

    public String getNetworkRecordId() {
        return networkRecordId;
    }
}

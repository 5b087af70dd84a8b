package com.work.genealogy.host.chain.web3j;

import com.work.genealogy.core.chain.ChainBlock;
import com.work.genealogy.core.chain.ChainBlockClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.methods.response.EthBlock;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

/**
 * 基于 Web3j 的区块查询：eth_getBlockByNumber。
 */
public class Web3jChainBlockClient implements ChainBlockClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainBlockClient.class);

    private final Web3j web3j;

    public Web3jChainBlockClient(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public Optional<ChainBlock> getBlockByNumber(long height, boolean fullTransactions) {
        try {
            EthBlock resp = web3j.ethGetBlockByNumber(DefaultBlockParameter.valueOf(BigInteger.valueOf(height)), fullTransactions).send();
            if (resp.hasError()) {
                throw new RuntimeException("eth_getBlockByNumber error height=" + height + " err=" + resp.getError().getMessage());
            }
            EthBlock.Block block = resp.getBlock();
            if (block == null || block.getHash() == null) {
                return Optional.empty();
            }
            return Optional.of(new ChainBlock(height, block.getHash()));
        } catch (IOException e) {
            log.warn("Web3j getBlockByNumber failed. height={} err={}", height, e.getMessage());
            throw new RuntimeException(e);
        }
    }
}

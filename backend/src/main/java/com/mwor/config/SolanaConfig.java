package com.mwor.config;

import org.p2p.solanaj.rpc.RpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "mwor.oracle", name = "mode", havingValue = "solana")
public class SolanaConfig {

    private static final Logger log = LoggerFactory.getLogger(SolanaConfig.class);

    @Bean
    public RpcClient solanaRpcClient(MworRuntimeProperties runtimeProperties) {
        String rpcUrl = runtimeProperties.getOracle().getRpcUrl();
        log.info("Initializing Solana RPC client for VRF oracle at {}", rpcUrl);
        return new RpcClient(rpcUrl);
    }
}

package com.metascan.explorer.config;

import com.metascan.explorer.modules.chain.ChainRpcClient;
import com.metascan.explorer.modules.chain.DisabledChainRpcClient;
import com.metascan.explorer.modules.chain.Web3jChainRpcClient;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.http.HttpService;

@Slf4j
@Configuration
public class ChainRpcConfig {

    @Bean
    public ChainRpcClient chainRpcClient(ExplorerProperties properties) {
        ExplorerProperties.Rpc rpc = properties.getRpc();
        if (!rpc.isEnabled() || rpc.getUrl() == null || rpc.getUrl().isBlank()) {
            log.info("Chain RPC disabled; account details use stored balances only");
            return new DisabledChainRpcClient();
        }
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(rpc.getTimeout())
                .build();
        log.info("Chain RPC client for {} using {}", rpc.getUrl(), rpc.getBalanceMethod());
        return new Web3jChainRpcClient(new HttpService(rpc.getUrl(), httpClient), rpc.getBalanceMethod());
    }
}

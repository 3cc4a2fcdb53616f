package com.copytrader.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Endpoints of the transaction network, the bundle relays and the swap aggregator.
 *
 * <pre>
 * copytrader.network.primary-rpc-url=https://mainnet.helius-rpc.com/?api-key=...
 * copytrader.network.fallback-rpc-url=https://api.mainnet-beta.solana.com
 * copytrader.network.bundle-relay-url=https://mainnet.block-engine.jito.wtf
 * copytrader.network.secondary-relay-url=https://sender.helius-rpc.com/fast
 * copytrader.network.swap-api-url=https://quote-api.jup.ag/v6
 * copytrader.network.operator-keypair=${OPERATOR_KEYPAIR:}
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "copytrader.network")
public class NetworkProperties {

    private String primaryRpcUrl;
    private String fallbackRpcUrl;
    private String bundleRelayUrl;
    private String secondaryRelayUrl;
    private String swapApiUrl;

    /** Base58-encoded 64-byte Ed25519 keypair (seed followed by public key). */
    private String operatorKeypair;

    private int slippageBps = 100;
    private Duration connectTimeout = Duration.ofMillis(1000);
    private Duration readTimeout = Duration.ofMillis(2000);
}

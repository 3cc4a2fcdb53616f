package com.copytrader.solana;

import com.copytrader.domain.enums.OnChainStatus;
import com.copytrader.execution.SignedTransaction;
import com.copytrader.execution.TransactionNetwork;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransactionNetwork} backed by a Solana JSON-RPC endpoint.
 *
 * <p>Read calls are rate-limited per endpoint. {@link #sendTransaction} is never retried
 * here: a resend of a transaction whose first attempt landed is harmless on chain, but the
 * retry decision belongs to the executor.
 */
public class SolanaRpcClient implements TransactionNetwork {

    private static final Logger log = LoggerFactory.getLogger(SolanaRpcClient.class);

    private final String name;
    private final String url;
    private final JsonRpcClient jsonRpcClient;

    public SolanaRpcClient(String name, String url, JsonRpcClient jsonRpcClient) {
        this.name = name;
        this.url = url;
        this.jsonRpcClient = jsonRpcClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    @RateLimiter(name = "solanaRpc")
    public boolean isHealthy() {
        try {
            return "ok".equals(jsonRpcClient.call(url, "getHealth", List.of()).asText());
        } catch (NetworkException e) {
            log.debug("{} getHealth: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    @RateLimiter(name = "solanaRpc")
    public String getLatestBlockhash() {
        JsonNode result = jsonRpcClient.call(url, "getLatestBlockhash", List.of(Map.of("commitment", "confirmed")));
        String blockhash = result.path("value").path("blockhash").asText(null);
        if (blockhash == null) {
            throw new NetworkException(name + " getLatestBlockhash returned no blockhash");
        }
        return blockhash;
    }

    @Override
    public String sendTransaction(SignedTransaction transaction) {
        JsonNode result = jsonRpcClient.call(
                url,
                "sendTransaction",
                List.of(
                        transaction.toBase64(),
                        Map.of("encoding", "base64", "skipPreflight", true, "maxRetries", 0)));
        String signature = result.asText(null);
        if (signature == null || signature.isEmpty()) {
            throw new NetworkException(name + " sendTransaction returned no signature");
        }
        return signature;
    }

    /**
     * Confirmed when the transaction is found without an execution error. Absent, or landed
     * with an error, is NOT_FOUND: the intended state change did not happen. Any transport
     * or RPC failure is INDETERMINATE.
     */
    @Override
    @RateLimiter(name = "solanaRpc")
    public OnChainStatus getTransactionStatus(String signature) {
        JsonNode result;
        try {
            result = jsonRpcClient.call(
                    url,
                    "getTransaction",
                    List.of(
                            signature,
                            Map.of(
                                    "encoding", "json",
                                    "commitment", "confirmed",
                                    "maxSupportedTransactionVersion", 0)));
        } catch (NetworkException e) {
            log.warn("{} getTransaction {} failed: {}", name, signature, e.getMessage());
            return OnChainStatus.INDETERMINATE;
        }
        if (result == null || result.isNull() || result.isMissingNode()) {
            return OnChainStatus.NOT_FOUND;
        }
        JsonNode err = result.path("meta").path("err");
        if (err.isMissingNode() || err.isNull()) {
            return OnChainStatus.CONFIRMED;
        }
        log.info("{} transaction {} landed with error {}", name, signature, err);
        return OnChainStatus.NOT_FOUND;
    }
}

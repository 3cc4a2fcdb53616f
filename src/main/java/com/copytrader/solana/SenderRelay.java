package com.copytrader.solana;

import com.copytrader.domain.enums.SubmissionPath;
import com.copytrader.execution.BundleRelay;
import com.copytrader.execution.SignedTransaction;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Secondary relay: a staked sender endpoint that forwards a tipped transaction to
 * leaders and the block engine at once.
 */
public class SenderRelay implements BundleRelay {

    private final String url;
    private final JsonRpcClient jsonRpcClient;

    public SenderRelay(String url, JsonRpcClient jsonRpcClient) {
        this.url = url;
        this.jsonRpcClient = jsonRpcClient;
    }

    @Override
    public String name() {
        return "secondary-relay";
    }

    @Override
    public SubmissionPath path() {
        return SubmissionPath.SECONDARY_RELAY;
    }

    @Override
    public String submit(SignedTransaction transaction) {
        JsonNode result = jsonRpcClient.call(
                url,
                "sendTransaction",
                List.of(
                        transaction.toBase64(),
                        Map.of("encoding", "base64", "skipPreflight", true, "maxRetries", 0)));
        String signature = result.asText(null);
        if (signature == null || signature.isEmpty()) {
            throw new NetworkException("Secondary relay returned no signature");
        }
        return signature;
    }
}

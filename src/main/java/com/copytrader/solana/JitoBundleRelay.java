package com.copytrader.solana;

import com.copytrader.domain.enums.SubmissionPath;
import com.copytrader.execution.BundleRelay;
import com.copytrader.execution.SignedTransaction;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Block-engine relay: submits the transaction as a single-transaction bundle via
 * {@code sendBundle} on {@code {endpoint}/api/v1/bundles}.
 */
public class JitoBundleRelay implements BundleRelay {

    private final String bundlesUrl;
    private final JsonRpcClient jsonRpcClient;

    public JitoBundleRelay(String endpoint, JsonRpcClient jsonRpcClient) {
        this.bundlesUrl = stripTrailingSlash(endpoint) + "/api/v1/bundles";
        this.jsonRpcClient = jsonRpcClient;
    }

    @Override
    public String name() {
        return "bundle-relay";
    }

    @Override
    public SubmissionPath path() {
        return SubmissionPath.BUNDLE_RELAY;
    }

    @Override
    public String submit(SignedTransaction transaction) {
        JsonNode result = jsonRpcClient.call(
                bundlesUrl, "sendBundle", List.of(List.of(transaction.toBase64()), Map.of("encoding", "base64")));
        String bundleId = result.isTextual() ? result.asText() : result.path("bundleId").asText(null);
        if (bundleId == null || bundleId.isEmpty()) {
            throw new NetworkException("sendBundle returned no bundle id");
        }
        return bundleId;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

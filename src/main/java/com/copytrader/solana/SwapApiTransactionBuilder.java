package com.copytrader.solana;

import com.copytrader.config.NetworkProperties;
import com.copytrader.domain.model.Signal;
import com.copytrader.execution.SignedTransaction;
import com.copytrader.execution.TransactionBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds swap transactions through a quote/swap aggregator API.
 *
 * <p>Buys spend exactly {@code amount} SOL (ExactIn SOL -> token). Sells receive exactly
 * {@code amount} SOL (ExactOut token -> SOL). The aggregator returns an unsigned transaction;
 * its blockhash is replaced with the one the executor fetched and it is signed locally.
 */
public class SwapApiTransactionBuilder implements TransactionBuilder {

    private static final Logger log = LoggerFactory.getLogger(SwapApiTransactionBuilder.class);

    static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";
    private static final BigDecimal LAMPORTS_PER_SOL = BigDecimal.valueOf(1_000_000_000L);

    private final RestTemplate restTemplate;
    private final NetworkProperties networkProperties;
    private final TransactionSigner signer;

    public SwapApiTransactionBuilder(
            RestTemplate restTemplate, NetworkProperties networkProperties, TransactionSigner signer) {
        this.restTemplate = restTemplate;
        this.networkProperties = networkProperties;
        this.signer = signer;
    }

    @Override
    public SignedTransaction build(Signal signal, BigDecimal tipSol, String recentBlockhash) {
        JsonNode quote = fetchQuote(signal);
        byte[] unsigned = fetchSwapTransaction(quote, tipSol);
        byte[] signed = SolanaTransactionCodec.replaceBlockhashAndSign(unsigned, Base58.decode(recentBlockhash), signer);
        String signature = SolanaTransactionCodec.firstSignature(signed);
        log.debug("Built {} {} tx {} ({} bytes, tip {} SOL)", signal.getAction(), signal.getToken(), signature,
                signed.length, tipSol);
        return new SignedTransaction(signed, signature, tipSol);
    }

    private JsonNode fetchQuote(Signal signal) {
        boolean sell = signal.isSell();
        String url = UriComponentsBuilder.fromUriString(networkProperties.getSwapApiUrl())
                .path("/quote")
                .queryParam("inputMint", sell ? signal.getMint() : WRAPPED_SOL_MINT)
                .queryParam("outputMint", sell ? WRAPPED_SOL_MINT : signal.getMint())
                .queryParam("amount", toLamports(signal.getAmount()))
                .queryParam("slippageBps", networkProperties.getSlippageBps())
                .queryParam("swapMode", sell ? "ExactOut" : "ExactIn")
                .toUriString();
        try {
            JsonNode quote = restTemplate.getForObject(url, JsonNode.class);
            if (quote == null || quote.has("error")) {
                throw new NetworkException("Quote rejected: " + (quote != null ? quote.path("error").asText() : "empty"));
            }
            return quote;
        } catch (RestClientException e) {
            throw new NetworkException("Quote request failed: " + e.getMessage(), e);
        }
    }

    private byte[] fetchSwapTransaction(JsonNode quote, BigDecimal tipSol) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("quoteResponse", quote);
        body.put("userPublicKey", signer.publicKeyBase58());
        body.put("wrapAndUnwrapSol", true);
        body.put("dynamicComputeUnitLimit", true);
        if (tipSol.signum() > 0) {
            body.put("prioritizationFeeLamports", Map.of("jitoTipLamports", toLamports(tipSol)));
        }
        try {
            JsonNode response = restTemplate.postForObject(
                    networkProperties.getSwapApiUrl() + "/swap", body, JsonNode.class);
            String encoded = response != null ? response.path("swapTransaction").asText(null) : null;
            if (encoded == null) {
                throw new NetworkException("Swap response carried no transaction");
            }
            return Base64.getDecoder().decode(encoded);
        } catch (RestClientException e) {
            throw new NetworkException("Swap request failed: " + e.getMessage(), e);
        }
    }

    static long toLamports(BigDecimal sol) {
        return sol.multiply(LAMPORTS_PER_SOL).setScale(0, RoundingMode.DOWN).longValueExact();
    }
}

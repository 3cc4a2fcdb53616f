package com.copytrader.unit.solana;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.copytrader.domain.enums.OnChainStatus;
import com.copytrader.execution.SignedTransaction;
import com.copytrader.solana.JsonRpcClient;
import com.copytrader.solana.NetworkException;
import com.copytrader.solana.SolanaRpcClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SolanaRpcClientTest {

    private static final String URL = "https://rpc.example";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private JsonRpcClient jsonRpcClient;

    private SolanaRpcClient client;

    @BeforeEach
    void setUp() {
        client = new SolanaRpcClient("primary-rpc", URL, jsonRpcClient);
    }

    private static JsonNode json(String value) throws Exception {
        return MAPPER.readTree(value);
    }

    private void result(String method, String value) throws Exception {
        when(jsonRpcClient.call(eq(URL), eq(method), anyList())).thenReturn(json(value));
    }

    @Test
    @DisplayName("Transaction found without an error is confirmed")
    void confirmed() throws Exception {
        result("getTransaction", "{\"slot\":1,\"meta\":{\"err\":null}}");

        assertThat(client.getTransactionStatus("sig")).isEqualTo(OnChainStatus.CONFIRMED);
    }

    @Test
    @DisplayName("Absent transaction is not found")
    void absent() throws Exception {
        result("getTransaction", "null");

        assertThat(client.getTransactionStatus("sig")).isEqualTo(OnChainStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("Transaction that landed with an error counts as not found")
    void landedWithError() throws Exception {
        result("getTransaction", "{\"meta\":{\"err\":{\"InstructionError\":[0,\"Custom\"]}}}");

        assertThat(client.getTransactionStatus("sig")).isEqualTo(OnChainStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("RPC failure during lookup is indeterminate, never a guess")
    void rpcFailureIndeterminate() {
        when(jsonRpcClient.call(eq(URL), eq("getTransaction"), anyList()))
                .thenThrow(new NetworkException("getTransaction error -32005: Node is behind"));

        assertThat(client.getTransactionStatus("sig")).isEqualTo(OnChainStatus.INDETERMINATE);
    }

    @Test
    @DisplayName("Health reflects the node's getHealth answer")
    void health() throws Exception {
        result("getHealth", "\"ok\"");
        assertThat(client.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("An unhealthy node error reads as unhealthy")
    void unhealthy() {
        when(jsonRpcClient.call(eq(URL), eq("getHealth"), anyList()))
                .thenThrow(new NetworkException("getHealth error -32005: Node is unhealthy"));

        assertThat(client.isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Latest blockhash is read from the result value")
    void latestBlockhash() throws Exception {
        result("getLatestBlockhash",
                "{\"context\":{\"slot\":5},\"value\":{\"blockhash\":\"EkSnNWid2cvwEVnVx9aBqawnmiCNiDgp3gUdkDPTKN1N\","
                        + "\"lastValidBlockHeight\":300}}");

        assertThat(client.getLatestBlockhash()).isEqualTo("EkSnNWid2cvwEVnVx9aBqawnmiCNiDgp3gUdkDPTKN1N");
    }

    @Test
    @DisplayName("sendTransaction without a signature in the result is an error")
    void sendWithoutSignature() throws Exception {
        result("sendTransaction", "\"\"");

        assertThatThrownBy(() -> client.sendTransaction(new SignedTransaction(new byte[] {1, 2}, "sig", BigDecimal.ZERO)))
                .isInstanceOf(NetworkException.class);
    }
}

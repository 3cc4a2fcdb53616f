package com.copytrader.solana;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Minimal JSON-RPC 2.0 over HTTP POST.
 */
public class JsonRpcClient {

    private final RestTemplate restTemplate;
    private final AtomicLong requestId = new AtomicLong();

    public JsonRpcClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * @return the {@code result} node, possibly a JSON null
     * @throws NetworkException on transport failure or a JSON-RPC {@code error}
     */
    public JsonNode call(String url, String method, List<?> params) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jsonrpc", "2.0");
        payload.put("id", requestId.incrementAndGet());
        payload.put("method", method);
        if (params != null && !params.isEmpty()) {
            payload.put("params", params);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        JsonNode response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(payload, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new NetworkException(method + " transport error: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new NetworkException(method + " returned an empty body");
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new NetworkException(method + " error " + error.path("code").asText() + ": "
                    + error.path("message").asText());
        }
        return response.path("result");
    }
}

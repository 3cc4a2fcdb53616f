package com.copytrader.notification;

import com.copytrader.domain.enums.AlertSeverity;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Sends alerts through the Telegram Bot API.
 *
 * <p>Non-critical alerts share a per-minute budget and are dropped with a warning once
 * it is spent. CRITICAL alerts (breaker trips) always go out.
 */
@Component
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore budget;

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplateBuilder restTemplateBuilder) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplateBuilder.build();
        this.budget = new Semaphore(Math.max(1, telegramConfig.getMaxMessagesPerMinute()));
    }

    /**
     * @return true if the message was handed to Telegram
     */
    public boolean send(String text, AlertSeverity severity) {
        if (!telegramConfig.isUsable()) {
            log.debug("Telegram notifications disabled");
            return false;
        }
        if (severity != AlertSeverity.CRITICAL) {
            if (!budget.tryAcquire()) {
                log.warn("Telegram budget of {}/min spent, dropping {} alert", telegramConfig.getMaxMessagesPerMinute(),
                        severity);
                return false;
            }
            CompletableFuture.delayedExecutor(1, TimeUnit.MINUTES).execute(budget::release);
        }

        try {
            Map<String, Object> payload = Map.of(
                    "chat_id", telegramConfig.getChatId(),
                    "text", text,
                    "parse_mode", "HTML",
                    "disable_web_page_preview", true);
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            restTemplate.postForEntity(
                    String.format(TELEGRAM_API_URL, telegramConfig.getBotToken()),
                    new HttpEntity<>(payload, headers),
                    String.class);
            log.debug("Telegram {} alert sent", severity);
            return true;
        } catch (Exception e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
            return false;
        }
    }
}

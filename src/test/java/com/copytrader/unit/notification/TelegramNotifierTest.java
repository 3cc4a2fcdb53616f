package com.copytrader.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.notification.TelegramConfig;
import com.copytrader.notification.TelegramNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;

class TelegramNotifierTest {

    private static final String URL = "https://api.telegram.org/bot123:abc/sendMessage";

    private TelegramConfig config;
    private MockServerRestTemplateCustomizer customizer;

    @BeforeEach
    void setUp() {
        config = new TelegramConfig();
        config.setEnabled(true);
        config.setBotToken("123:abc");
        config.setChatId("-100200");
        config.setMaxMessagesPerMinute(2);
        customizer = new MockServerRestTemplateCustomizer();
    }

    private TelegramNotifier notifier() {
        return new TelegramNotifier(config, new RestTemplateBuilder(customizer));
    }

    @Test
    @DisplayName("Posts HTML messages to the configured chat")
    void sends() {
        TelegramNotifier notifier = notifier();
        MockRestServiceServer server = customizer.getServer();
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.chat_id").value("-100200"))
                .andExpect(jsonPath("$.parse_mode").value("HTML"))
                .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

        assertThat(notifier.send("<b>hello</b>", AlertSeverity.INFO)).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("Non-critical alerts beyond the per-minute budget are dropped, critical ones still go out")
    void budget() {
        TelegramNotifier notifier = notifier();
        MockRestServiceServer server = customizer.getServer();
        server.expect(ExpectedCount.times(3), requestTo(URL))
                .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

        assertThat(notifier.send("1", AlertSeverity.INFO)).isTrue();
        assertThat(notifier.send("2", AlertSeverity.WARNING)).isTrue();
        assertThat(notifier.send("3", AlertSeverity.INFO)).isFalse();
        assertThat(notifier.send("halt", AlertSeverity.CRITICAL)).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("Disabled or incomplete configuration sends nothing")
    void disabled() {
        config.setChatId(" ");

        assertThat(notifier().send("x", AlertSeverity.CRITICAL)).isFalse();
    }

    @Test
    @DisplayName("Telegram errors are reported as not sent")
    void serverError() {
        TelegramNotifier notifier = notifier();
        customizer.getServer().expect(requestTo(URL)).andRespond(withServerError());

        assertThat(notifier.send("x", AlertSeverity.CRITICAL)).isFalse();
    }
}

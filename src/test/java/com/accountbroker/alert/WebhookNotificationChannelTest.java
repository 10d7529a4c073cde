package com.accountbroker.alert;

import com.accountbroker.exception.NotificationDeliveryException;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookNotificationChannelTest {

    private final HttpClient httpClient = mock(HttpClient.class);
    private final WebhookNotificationChannel channel =
            new WebhookNotificationChannel(httpClient, "https://hooks.example.com/services/T000/B000");

    @Test
    @SuppressWarnings("unchecked")
    void postsJsonPayload() throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));

        channel.send("#eng-alerts", "<!here> 熔断器打开: acct-1", Severity.CRITICAL);

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any(HttpResponse.BodyHandler.class));
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().uri().getHost()).isEqualTo("hooks.example.com");
        assertThat(request.getValue().headers().firstValue("Content-Type")).contains("application/json");
    }

    @Test
    @SuppressWarnings("unchecked")
    void non2xxIsDeliveryFailure() throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(500);
        when(response.body()).thenReturn(JSONObject.of("ok", false).toJSONString());
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));

        assertThatThrownBy(() -> channel.send("#eng-alerts", "x", Severity.WARNING))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasMessageContaining("500");
    }

    @Test
    void ioErrorIsDeliveryFailure() throws Exception {
        doThrow(new IOException("connection reset"))
                .when(httpClient).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));

        assertThatThrownBy(() -> channel.send("#eng-alerts", "x", Severity.WARNING))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}

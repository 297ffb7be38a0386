package com.company.alerting.service.notification;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.exception.NotificationDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.Map;

/**
 * JSON POST to a third-party endpoint with bounded timeouts.
 */
@Component
@Slf4j
public class WebhookClient {

    private final RestClient restClient;

    public WebhookClient(AlertingProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getDelivery().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getDelivery().getReadTimeout().toMillis());

        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    /**
     * @throws NotificationDeliveryException on a non-2xx answer or an I/O failure
     */
    public void postJson(String url, Map<String, Object> body, Map<String, String> headers) {
        String host = hostOf(url);
        try {
            restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> headers.forEach(h::set))
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Delivered webhook to {}", host);
        } catch (RestClientResponseException e) {
            throw new NotificationDeliveryException(
                    "HTTP " + e.getStatusCode().value() + " from " + host + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new NotificationDeliveryException("Request to " + host + " failed: " + e.getMessage(), e);
        }
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}

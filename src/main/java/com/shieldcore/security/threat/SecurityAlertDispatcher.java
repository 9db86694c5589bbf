package com.shieldcore.security.threat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldcore.security.sanitize.DataSanitizer;
import com.shieldcore.utils.JsonSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class SecurityAlertDispatcher implements SecurityEventListener {

    private final SecurityAlertProperties properties;
    private final ObjectProvider<ObjectMapper> objectMapperProvider;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final DataSanitizer sanitizer;

    public SecurityAlertDispatcher(
            SecurityAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider,
            DataSanitizer sanitizer
    ) {
        this.properties = properties;
        this.objectMapperProvider = objectMapperProvider;
        this.mailSenderProvider = mailSenderProvider;
        this.sanitizer = sanitizer;
    }

    @Override
    public void onEvent(SecurityEvent event) {
        if (properties == null || event == null || !event.severity().atLeast(properties.getMinSeverity())) {
            return;
        }
        sendWebhook(event);
        sendSmtp(event);
    }

    private void sendWebhook(SecurityEvent event) {
        SecurityAlertProperties.Webhook webhook = properties.getWebhook();
        if (webhook == null || !webhook.isEnabled() || webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            return;
        }
        try {
            ObjectMapper mapper = objectMapperProvider.getIfAvailable(JsonSupport::objectMapper);
            String payload = mapper.writeValueAsString(buildPayload(event, webhook.isIncludeMetadata()));
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofMillis(webhook.getConnectTimeoutMs()))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(Duration.ofMillis(webhook.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();
            client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        } catch (Exception ex) {
            log.warn("security webhook alert failed: {}", ex.getMessage());
        }
    }

    private void sendSmtp(SecurityEvent event) {
        SecurityAlertProperties.Smtp smtp = properties.getSmtp();
        if (smtp == null || !smtp.isEnabled()) {
            return;
        }
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null || smtp.getFrom() == null || smtp.getFrom().isBlank() || smtp.getTo().isEmpty()) {
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(smtp.getFrom());
            message.setTo(smtp.getTo().toArray(new String[0]));
            message.setSubject(smtp.getSubject() + " [" + event.severity().code() + "]");
            message.setText(buildMailBody(event, smtp.isIncludeMetadata()));
            sender.send(message);
        } catch (Exception ex) {
            log.warn("security smtp alert failed: {}", ex.getMessage());
        }
    }

    Map<String, Object> buildPayload(SecurityEvent event, boolean includeMetadata) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", event.timestamp().toString());
        payload.put("threat_type", event.threatType().code());
        payload.put("severity", event.severity().code());
        payload.put("source", event.sourceComponent());
        payload.put("description", event.description());
        payload.put("identifier", event.identifier());
        if (includeMetadata) {
            payload.put("metadata", sanitizer.sanitize(event.metadata(), "alert"));
        }
        return payload;
    }

    private String buildMailBody(SecurityEvent event, boolean includeMetadata) {
        StringBuilder sb = new StringBuilder();
        sb.append("Security alert\n");
        sb.append("timestamp: ").append(event.timestamp()).append('\n');
        sb.append("threat: ").append(event.threatType().code()).append('\n');
        sb.append("severity: ").append(event.severity().code()).append('\n');
        sb.append("source: ").append(event.sourceComponent()).append('\n');
        sb.append("description: ").append(event.description()).append('\n');
        sb.append("identifier: ").append(event.identifier()).append('\n');
        if (includeMetadata) {
            sb.append("metadata: ").append(sanitizer.sanitize(event.metadata(), "alert")).append('\n');
        }
        return sb.toString();
    }
}

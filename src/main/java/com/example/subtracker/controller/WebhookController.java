package com.example.subtracker.controller;

import com.example.subtracker.exception.MalformedEventException;
import com.example.subtracker.exception.UnauthenticatedRequestException;
import com.example.subtracker.model.IngestionOutcome;
import com.example.subtracker.model.WebhookMessage;
import com.example.subtracker.service.EventIngestionService;
import com.example.subtracker.util.Constants;
import com.example.subtracker.validator.WebhookPayloadValidator;
import com.example.subtracker.validator.WebhookSignatureValidator;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhook")
@Slf4j
public class WebhookController {

    private final WebhookSignatureValidator signatureValidator;
    private final WebhookPayloadValidator payloadValidator;
    private final EventIngestionService eventIngestionService;
    private final Counter webhookRejectedTotal;
    private final Counter webhookMalformedTotal;

    public WebhookController(WebhookSignatureValidator signatureValidator,
                             WebhookPayloadValidator payloadValidator,
                             EventIngestionService eventIngestionService,
                             Counter webhookRejectedTotal,
                             Counter webhookMalformedTotal) {
        this.signatureValidator = signatureValidator;
        this.payloadValidator = payloadValidator;
        this.eventIngestionService = eventIngestionService;
        this.webhookRejectedTotal = webhookRejectedTotal;
        this.webhookMalformedTotal = webhookMalformedTotal;
    }

    /**
     * EventSub delivery endpoint. The signature is checked against the raw bytes before
     * anything is parsed. Deliveries that pass the check but carry an unknown payload are
     * still acknowledged so Twitch does not keep redelivering them.
     */
    @PostMapping
    public ResponseEntity<String> handleWebhook(
            @RequestHeader(value = Constants.Headers.MESSAGE_ID, required = false) String messageId,
            @RequestHeader(value = Constants.Headers.MESSAGE_TIMESTAMP, required = false) String timestamp,
            @RequestHeader(value = Constants.Headers.MESSAGE_SIGNATURE, required = false) String signature,
            @RequestHeader(value = Constants.Headers.MESSAGE_TYPE, required = false) String messageType,
            @RequestBody(required = false) byte[] body) {

        if (!signatureValidator.verify(messageId, timestamp, body, signature)) {
            webhookRejectedTotal.increment();
            log.warn("Rejected webhook delivery: messageId={}, type={}", messageId, messageType);
            throw new UnauthenticatedRequestException();
        }

        log.info("Received webhook delivery: messageId={}, type={}", messageId, messageType);
        try {
            WebhookMessage message = payloadValidator.parse(body, messageType);
            IngestionOutcome outcome = eventIngestionService.handle(message);
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(outcome.responseBody());
        } catch (MalformedEventException e) {
            webhookMalformedTotal.increment();
            log.warn("Acknowledging malformed webhook delivery: messageId={}, type={}, error={}",
                    messageId, messageType, e.getMessage());
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(IngestionOutcome.ACKNOWLEDGED_BODY);
        }
    }
}

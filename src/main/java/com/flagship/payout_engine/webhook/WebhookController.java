package com.flagship.payout_engine.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Ingress for processor webhooks.
 *
 * The body is bound as bytes so the signature is checked against exactly
 * what the processor signed, before any decoding.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    private final WebhookProcessor webhookProcessor;

    @PostMapping("/payouts")
    public ResponseEntity<HandlerResult> receivePayoutWebhook(
            @RequestBody byte[] rawPayload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) throws IOException {

        HandlerResult result = webhookProcessor.handle(rawPayload, signature);
        log.debug("Webhook handled: eventId={}, outcome={}, status={}",
                result.getEventId(), result.getOutcome(), result.getHttpStatus());
        return ResponseEntity.status(result.getHttpStatus()).body(result);
    }
}

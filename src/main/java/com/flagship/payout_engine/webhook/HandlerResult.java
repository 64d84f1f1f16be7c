package com.flagship.payout_engine.webhook;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Answer returned to the webhook sender.
 *
 * Only a missing or invalid signature produces a non-2xx status. Every
 * other outcome, including internal failures, is success-shaped so that the
 * sender does not start a retry storm.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HandlerResult {
    int httpStatus;
    boolean accepted;
    boolean duplicate;
    String eventId;
    WebhookOutcome outcome;
    String transactionId;
    String message;

    static HandlerResult missingSignature() {
        return HandlerResult.builder()
                .httpStatus(400)
                .accepted(false)
                .message("Missing webhook signature")
                .build();
    }

    static HandlerResult invalidSignature() {
        return HandlerResult.builder()
                .httpStatus(401)
                .accepted(false)
                .message("Invalid webhook signature")
                .build();
    }

    static HandlerResult duplicate(String eventId) {
        return HandlerResult.builder()
                .httpStatus(200)
                .accepted(true)
                .duplicate(true)
                .eventId(eventId)
                .message("Event already processed")
                .build();
    }

    static HandlerResult handled(String eventId, WebhookOutcome outcome, String transactionId, String message) {
        return HandlerResult.builder()
                .httpStatus(200)
                .accepted(true)
                .eventId(eventId)
                .outcome(outcome)
                .transactionId(transactionId)
                .message(message)
                .build();
    }
}

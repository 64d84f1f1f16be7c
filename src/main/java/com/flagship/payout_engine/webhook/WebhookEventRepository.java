package com.flagship.payout_engine.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEventEntity, String> {

    /**
     * Recorded events for a payout, oldest first. Used when investigating a discrepancy.
     */
    List<WebhookEventEntity> findByExternalPayoutIdOrderByReceivedAtAsc(String externalPayoutId);

    long countByOutcome(WebhookOutcome outcome);
}

package com.flagship.payout_engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the payout engine.
 *
 * Every component that needs processor credentials, retry constants or batch
 * sizes receives this object through its constructor. Nothing below the
 * configuration layer reads the environment directly.
 */
@ConfigurationProperties(prefix = "payout")
@Getter
@Setter
public class PayoutProperties {

    private final Processor processor = new Processor();
    private final Webhook webhook = new Webhook();
    private final Retry retry = new Retry();
    private final Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Processor {
        /**
         * Base URL of the payout processor API.
         */
        private String baseUrl = "https://api.razorpay.com/v1";

        private String keyId;

        private String keySecret;

        /**
         * Business account number payouts are debited from.
         */
        private String accountNumber;

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(10);

        /**
         * Passed as queue_if_low_balance on payout creation.
         */
        private boolean queueIfLowBalance = true;
    }

    @Getter
    @Setter
    public static class Webhook {
        /**
         * Shared secret for the HMAC-SHA256 webhook signature.
         */
        private String secret;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;

        private Duration initialDelay = Duration.ofSeconds(60);

        private Duration maxDelay = Duration.ofHours(1);

        private double backoffMultiplier = 2.0;

        /**
         * Max transactions resubmitted per run.
         */
        private int batchSize = 50;

        /**
         * How long a claimed retry is hidden from other workers while the
         * processor call is in flight.
         */
        private Duration claimLease = Duration.ofMinutes(5);

        private boolean schedulerEnabled = true;

        private Duration pollInterval = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Reconciliation {
        /**
         * Max transactions polled per run.
         */
        private int batchSize = 100;

        private boolean schedulerEnabled = true;

        private Duration pollInterval = Duration.ofMinutes(5);
    }
}

package com.flagship.payout_engine.processor;

/**
 * Operations consumed from the external payout processor.
 *
 * Implementations must bound every call with a timeout and report failures
 * as {@link PayoutGatewayException}.
 */
public interface PayoutGateway {

    ProcessorPayout createPayout(CreatePayoutCommand command);

    ProcessorPayout getPayout(String externalPayoutId);

    ProcessorPayout cancelPayout(String externalPayoutId);

    ProcessorContact createContact(CreateContactCommand command);

    ProcessorFundAccount createFundAccount(CreateFundAccountCommand command);

    ProcessorFundAccount setFundAccountActive(String fundAccountId, boolean active);

    /**
     * Checks a webhook signature against the raw request body.
     */
    boolean verifySignature(byte[] rawBody, String signature);
}

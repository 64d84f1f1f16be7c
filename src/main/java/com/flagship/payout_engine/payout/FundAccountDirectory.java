package com.flagship.payout_engine.payout;

import java.util.Optional;

/**
 * Lookup of fund accounts at submission time. Registration and
 * deactivation go through {@link FundAccountService}.
 */
public interface FundAccountDirectory {

    Optional<FundAccount> findByReference(String reference);
}

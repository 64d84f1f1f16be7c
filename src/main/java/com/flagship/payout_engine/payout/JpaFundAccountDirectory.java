package com.flagship.payout_engine.payout;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaFundAccountDirectory implements FundAccountDirectory {

    private final FundAccountRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<FundAccount> findByReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        return repository.findById(reference).map(FundAccountEntity::toDomain);
    }
}

package com.flagship.payout_engine.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FundAccountRepository extends JpaRepository<FundAccountEntity, String> {

    Optional<FundAccountEntity> findByUserIdAndAccountFingerprint(String userId, String accountFingerprint);

    Optional<FundAccountEntity> findByUserIdAndVpaAddress(String userId, String vpaAddress);

    List<FundAccountEntity> findByUserIdAndActiveTrueOrderByCreatedAtAsc(String userId);
}

package com.flagship.payout_engine.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PayoutContactRepository extends JpaRepository<PayoutContactEntity, String> {
}

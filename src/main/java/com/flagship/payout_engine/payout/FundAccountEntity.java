package com.flagship.payout_engine.payout;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "fund_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FundAccountEntity {

    @Id
    @Column(name = "reference", nullable = false, updatable = false, length = 64)
    private String reference;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "processor_fund_account_id", nullable = false, length = 64)
    private String processorFundAccountId;

    @Column(name = "processor_contact_id", length = 64)
    private String processorContactId;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 20)
    private FundAccount.AccountType accountType;

    @Column(name = "beneficiary_name")
    private String beneficiaryName;

    @Column(name = "ifsc", length = 11)
    private String ifsc;

    @Column(name = "account_number_last4", length = 4)
    private String accountNumberLast4;

    // SHA-256 of ifsc:accountNumber, for duplicate detection without storing the number
    @Column(name = "account_fingerprint", length = 64)
    private String accountFingerprint;

    @Column(name = "vpa_address", length = 64)
    private String vpaAddress;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    static FundAccountEntity create(FundAccount account, String accountFingerprint, Instant now) {
        FundAccountEntity entity = new FundAccountEntity();
        entity.reference = account.getReference();
        entity.userId = account.getUserId();
        entity.processorFundAccountId = account.getProcessorFundAccountId();
        entity.processorContactId = account.getProcessorContactId();
        entity.accountType = account.getAccountType();
        entity.beneficiaryName = account.getBeneficiaryName();
        entity.ifsc = account.getIfsc();
        entity.accountNumberLast4 = account.getAccountNumberLast4();
        entity.accountFingerprint = accountFingerprint;
        entity.vpaAddress = account.getVpaAddress();
        entity.active = account.isActive();
        entity.createdAt = now;
        entity.updatedAt = now;
        return entity;
    }

    void activate(Instant now) {
        this.active = true;
        this.updatedAt = now;
    }

    void deactivate(Instant now) {
        this.active = false;
        this.updatedAt = now;
    }

    FundAccount toDomain() {
        return FundAccount.builder()
                .reference(reference)
                .userId(userId)
                .processorFundAccountId(processorFundAccountId)
                .processorContactId(processorContactId)
                .accountType(accountType)
                .beneficiaryName(beneficiaryName)
                .ifsc(ifsc)
                .accountNumberLast4(accountNumberLast4)
                .vpaAddress(vpaAddress)
                .active(active)
                .build();
    }
}

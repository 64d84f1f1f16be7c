package com.flagship.payout_engine.payout;

import com.flagship.payout_engine.payout.exception.FundAccountNotFoundException;
import com.flagship.payout_engine.processor.CreateContactCommand;
import com.flagship.payout_engine.processor.CreateFundAccountCommand;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.ProcessorContact;
import com.flagship.payout_engine.processor.ProcessorFundAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registers, lists and deactivates the fund accounts payouts are sent to.
 *
 * Each user gets one processor contact, created on first registration.
 * Registering a bank account or VPA the user already has returns the
 * existing record; an inactive one is reactivated at the processor first.
 * Processor failures surface as {@link com.flagship.payout_engine.processor.PayoutGatewayException}.
 * No database transaction is held across a processor call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundAccountService {

    static final String CONTACT_TYPE = "customer";
    private static final String REFERENCE_PREFIX = "fa_";

    private final FundAccountRepository fundAccountRepository;
    private final PayoutContactRepository contactRepository;
    private final PayoutGateway payoutGateway;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public FundAccountRegistrationResult register(FundAccountRegistration registration) {
        if (registration.getUserId() == null || registration.getUserId().isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        if (registration.getAccountType() == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        String userId = registration.getUserId();
        String holderName = FundAccountValidator.holderName(registration.getHolderName());

        CreateFundAccountCommand.CreateFundAccountCommandBuilder command = CreateFundAccountCommand.builder()
                .holderName(holderName);
        FundAccount.FundAccountBuilder account = FundAccount.builder()
                .userId(userId)
                .accountType(registration.getAccountType())
                .beneficiaryName(holderName)
                .active(true);
        String fingerprint = null;
        Optional<FundAccountEntity> existing;

        if (registration.getAccountType() == FundAccount.AccountType.BANK_ACCOUNT) {
            String ifsc = FundAccountValidator.ifsc(registration.getIfsc());
            String accountNumber = FundAccountValidator.accountNumber(registration.getAccountNumber());
            fingerprint = fingerprint(ifsc, accountNumber);
            existing = fundAccountRepository.findByUserIdAndAccountFingerprint(userId, fingerprint);
            command.accountType(CreateFundAccountCommand.BANK_ACCOUNT).ifsc(ifsc).accountNumber(accountNumber);
            account.ifsc(ifsc).accountNumberLast4(accountNumber.substring(accountNumber.length() - 4));
        } else {
            String vpa = FundAccountValidator.vpa(registration.getVpaAddress());
            existing = fundAccountRepository.findByUserIdAndVpaAddress(userId, vpa);
            command.accountType(CreateFundAccountCommand.VPA).vpaAddress(vpa);
            account.vpaAddress(vpa);
        }

        if (existing.isPresent()) {
            return new FundAccountRegistrationResult(reactivateIfNeeded(existing.get()), false);
        }

        PayoutContactEntity contact = getOrCreateContact(userId, holderName,
                registration.getEmail(), registration.getPhone());
        ProcessorFundAccount created = payoutGateway.createFundAccount(
                command.contactId(contact.getProcessorContactId()).build());

        FundAccount fundAccount = account
                .reference(newReference())
                .processorFundAccountId(created.getId())
                .processorContactId(contact.getProcessorContactId())
                .build();
        try {
            fundAccountRepository.save(FundAccountEntity.create(fundAccount, fingerprint, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            // A concurrent registration of the same account won the insert.
            Optional<FundAccountEntity> winner = fingerprint != null
                    ? fundAccountRepository.findByUserIdAndAccountFingerprint(userId, fingerprint)
                    : fundAccountRepository.findByUserIdAndVpaAddress(userId, fundAccount.getVpaAddress());
            return new FundAccountRegistrationResult(winner.orElseThrow(() -> e).toDomain(), false);
        }

        log.info("Fund account registered: userId={}, reference={}, type={}, processorFundAccountId={}",
                userId, fundAccount.getReference(), fundAccount.getAccountType(), created.getId());
        return new FundAccountRegistrationResult(fundAccount, true);
    }

    public List<FundAccount> listActive(String userId) {
        return fundAccountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId).stream()
                .map(FundAccountEntity::toDomain)
                .toList();
    }

    public FundAccount deactivate(String userId, String reference) {
        FundAccountEntity entity = fundAccountRepository.findById(reference)
                .filter(e -> e.getUserId().equals(userId))
                .orElseThrow(() -> new FundAccountNotFoundException(reference));
        if (!entity.isActive()) {
            return entity.toDomain();
        }

        payoutGateway.setFundAccountActive(entity.getProcessorFundAccountId(), false);
        entity.deactivate(clock.instant());
        fundAccountRepository.save(entity);
        log.info("Fund account deactivated: userId={}, reference={}", userId, reference);
        return entity.toDomain();
    }

    PayoutContactEntity getOrCreateContact(String userId, String name, String email, String phone) {
        Optional<PayoutContactEntity> existing = contactRepository.findById(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        String normalizedPhone = FundAccountValidator.phone(phone);
        String referenceId = "contact_" + userId + "_" + clock.millis();
        ProcessorContact contact = payoutGateway.createContact(CreateContactCommand.builder()
                .name(name)
                .email(email)
                .phone(normalizedPhone)
                .type(CONTACT_TYPE)
                .referenceId(referenceId)
                .notes(Map.of("user_id", userId))
                .build());

        PayoutContactEntity entity = new PayoutContactEntity(userId, contact.getId(), name, email,
                normalizedPhone, CONTACT_TYPE, referenceId, clock.instant());
        try {
            PayoutContactEntity saved = contactRepository.save(entity);
            log.info("Processor contact created: userId={}, contactId={}", userId, contact.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            return contactRepository.findById(userId).orElseThrow(() -> e);
        }
    }

    private FundAccount reactivateIfNeeded(FundAccountEntity entity) {
        if (entity.isActive()) {
            return entity.toDomain();
        }
        payoutGateway.setFundAccountActive(entity.getProcessorFundAccountId(), true);
        entity.activate(clock.instant());
        fundAccountRepository.save(entity);
        log.info("Fund account reactivated: userId={}, reference={}", entity.getUserId(), entity.getReference());
        return entity.toDomain();
    }

    private String newReference() {
        byte[] suffix = new byte[8];
        random.nextBytes(suffix);
        return REFERENCE_PREFIX + HexFormat.of().formatHex(suffix);
    }

    static String fingerprint(String ifsc, String accountNumber) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((ifsc + ":" + accountNumber).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}

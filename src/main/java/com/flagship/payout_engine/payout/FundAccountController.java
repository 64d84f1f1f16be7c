package com.flagship.payout_engine.payout;

import com.flagship.payout_engine.payout.dto.FundAccountResponse;
import com.flagship.payout_engine.payout.dto.RegisterBankAccountRequest;
import com.flagship.payout_engine.payout.dto.RegisterVpaRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Fund accounts of the caller given in X-User-Id.
 * Registration answers 201 for a new account and 200 when it already existed.
 */
@RestController
@RequestMapping("/api/fund-accounts")
@RequiredArgsConstructor
@Slf4j
public class FundAccountController {

    private static final String USER_ID_HEADER = "X-User-Id";

    private final FundAccountService fundAccountService;

    @PostMapping("/bank-accounts")
    public ResponseEntity<FundAccountResponse> registerBankAccount(
            @RequestHeader(USER_ID_HEADER) String userId,
            @Valid @RequestBody RegisterBankAccountRequest request) {

        log.info("Received bank account registration: userId={}", userId);
        return respond(fundAccountService.register(FundAccountRegistration.builder()
                .userId(userId)
                .accountType(FundAccount.AccountType.BANK_ACCOUNT)
                .holderName(request.holderName())
                .ifsc(request.ifsc())
                .accountNumber(request.accountNumber())
                .email(request.email())
                .phone(request.phone())
                .build()));
    }

    @PostMapping("/vpas")
    public ResponseEntity<FundAccountResponse> registerVpa(
            @RequestHeader(USER_ID_HEADER) String userId,
            @Valid @RequestBody RegisterVpaRequest request) {

        log.info("Received VPA registration: userId={}", userId);
        return respond(fundAccountService.register(FundAccountRegistration.builder()
                .userId(userId)
                .accountType(FundAccount.AccountType.VPA)
                .holderName(request.holderName())
                .vpaAddress(request.vpa())
                .email(request.email())
                .phone(request.phone())
                .build()));
    }

    @GetMapping
    public ResponseEntity<List<FundAccountResponse>> listFundAccounts(@RequestHeader(USER_ID_HEADER) String userId) {
        return ResponseEntity.ok(fundAccountService.listActive(userId).stream()
                .map(FundAccountResponse::from)
                .toList());
    }

    @PostMapping("/{reference}/deactivate")
    public ResponseEntity<FundAccountResponse> deactivate(
            @PathVariable("reference") String reference,
            @RequestHeader(USER_ID_HEADER) String userId) {
        return ResponseEntity.ok(FundAccountResponse.from(fundAccountService.deactivate(userId, reference)));
    }

    private static ResponseEntity<FundAccountResponse> respond(FundAccountRegistrationResult result) {
        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(FundAccountResponse.from(result.getFundAccount()));
    }
}

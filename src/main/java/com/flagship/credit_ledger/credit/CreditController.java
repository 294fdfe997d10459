package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.credit.dto.AdjustCreditRequest;
import com.flagship.credit_ledger.credit.dto.CancelCreditRequest;
import com.flagship.credit_ledger.credit.dto.CreditResponse;
import com.flagship.credit_ledger.credit.dto.ExtendExpirationRequest;
import com.flagship.credit_ledger.credit.dto.IssueCreditRequest;
import com.flagship.credit_ledger.credit.dto.LedgerResultResponse;
import com.flagship.credit_ledger.credit.dto.RedeemCreditRequest;
import com.flagship.credit_ledger.credit.dto.TransactionResponse;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST surface over {@link CreditLedgerService}.
 *
 * The caller is assumed to be authenticated upstream; the acting staff member, if any, is
 * passed in the X-Staff-Id header and recorded on the ledger entry.
 */
@RestController
@RequestMapping("/api/credits")
@RequiredArgsConstructor
@Slf4j
public class CreditController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String STAFF_ID_HEADER = "X-Staff-Id";

    private final CreditLedgerService creditLedgerService;

    /**
     * Issues a credit. Repeating the request with the same Idempotency-Key returns the
     * original credit with 200 instead of 201.
     */
    @PostMapping
    public ResponseEntity<LedgerResultResponse> issue(
            @Valid @RequestBody IssueCreditRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = STAFF_ID_HEADER, required = false) String staffId) {

        CurrencyCode currency;
        try {
            currency = CurrencyCode.valueOf(request.getCurrency());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency code: " + request.getCurrency());
        }

        log.info("Received credit issuance request: amount={}, currency={}, customerId={}, idempotencyKey={}",
            request.getAmount(), currency, request.getCustomerId(), idempotencyKey);

        LedgerResult result = creditLedgerService.issue(IssueCreditCommand.builder()
            .customerId(request.getCustomerId())
            .amount(request.getAmount())
            .currency(currency)
            .expirationDate(request.getExpirationDate())
            .note(request.getNote())
            .locationId(request.getLocationId())
            .staffId(staffId)
            .idempotencyKey(blankToNull(idempotencyKey))
            .build());

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(LedgerResultResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CreditResponse> getCredit(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CreditResponse.from(creditLedgerService.getCredit(id)));
    }

    @GetMapping("/code/{code}")
    public ResponseEntity<CreditResponse> getCreditByCode(@PathVariable("code") String code) {
        return ResponseEntity.ok(CreditResponse.from(creditLedgerService.getCreditByCode(code)));
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<List<TransactionResponse>> getHistory(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(creditLedgerService.getHistory(id).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<List<CreditResponse>> getCustomerCredits(
            @PathVariable("customerId") String customerId,
            @RequestParam(value = "includeTerminal", defaultValue = "false") boolean includeTerminal) {
        return ResponseEntity.ok(creditLedgerService.findCreditsByCustomer(customerId, includeTerminal).stream()
            .map(CreditResponse::from)
            .toList());
    }

    @PostMapping("/{id}/redeem")
    public ResponseEntity<LedgerResultResponse> redeem(
            @PathVariable("id") UUID id,
            @Valid @RequestBody RedeemCreditRequest request,
            @RequestHeader(value = STAFF_ID_HEADER, required = false) String staffId) {
        LedgerResult result = creditLedgerService.redeem(RedeemCreditCommand.builder()
            .creditId(id)
            .amount(request.getAmount())
            .orderId(request.getOrderId())
            .orderNumber(request.getOrderNumber())
            .locationId(request.getLocationId())
            .note(request.getNote())
            .staffId(staffId)
            .build());
        return ResponseEntity.ok(LedgerResultResponse.from(result));
    }

    @PostMapping("/{id}/adjust")
    public ResponseEntity<LedgerResultResponse> adjust(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AdjustCreditRequest request,
            @RequestHeader(value = STAFF_ID_HEADER, required = false) String staffId) {
        LedgerResult result = creditLedgerService.adjust(id, request.getAmount(), request.getReason(), staffId);
        return ResponseEntity.ok(LedgerResultResponse.from(result));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<LedgerResultResponse> cancel(
            @PathVariable("id") UUID id,
            @Valid @RequestBody(required = false) CancelCreditRequest request,
            @RequestHeader(value = STAFF_ID_HEADER, required = false) String staffId) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(LedgerResultResponse.from(creditLedgerService.cancel(id, reason, staffId)));
    }

    @PostMapping("/{id}/extend")
    public ResponseEntity<LedgerResultResponse> extendExpiration(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ExtendExpirationRequest request,
            @RequestHeader(value = STAFF_ID_HEADER, required = false) String staffId) {
        LedgerResult result = creditLedgerService.extendExpiration(
            id, request.getNewExpirationDate(), request.getReason(), staffId);
        return ResponseEntity.ok(LedgerResultResponse.from(result));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

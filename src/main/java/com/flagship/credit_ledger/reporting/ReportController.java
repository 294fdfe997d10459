package com.flagship.credit_ledger.reporting;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportingProjection projection;

    @PostMapping("/aggregate")
    public ResponseEntity<AggregateResult> aggregate(@RequestBody AggregateRequest request) {
        return ResponseEntity.ok(projection.aggregate(request.toFilter(), request.effectiveGroupBy(), request.toRange()));
    }

    @GetMapping("/stats")
    public ResponseEntity<CreditStats> stats() {
        return ResponseEntity.ok(projection.creditStats());
    }

    @GetMapping("/credits/{id}/balance")
    public ResponseEntity<Map<String, Object>> balanceAsOf(
            @PathVariable("id") UUID id,
            @RequestParam("asOf") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        BigDecimal balance = projection.balanceAsOf(id, asOf);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("creditId", id);
        body.put("asOf", asOf);
        body.put("balance", balance);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/credits/{id}/verify")
    public ResponseEntity<LedgerVerification> verify(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(projection.verify(id));
    }
}

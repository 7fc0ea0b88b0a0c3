package com.flagship.missed_call.wallet;

import com.flagship.missed_call.observability.CorrelationContext;
import com.flagship.missed_call.wallet.dto.WalletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read-only wallet API for the dashboard.
 *
 * Returns the current balance and the most recent transactions, newest
 * first. The page size defaults to 50 and is capped at 100.
 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final WalletLedgerService ledgerService;

    @GetMapping("/{customerId}")
    public ResponseEntity<WalletResponse> getWallet(
            @PathVariable("customerId") UUID customerId,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {

        MDC.put(CorrelationContext.CUSTOMER_ID_MDC_KEY, customerId.toString());
        try {
            Wallet wallet = ledgerService.getWallet(customerId);
            log.debug("Wallet lookup: balance={}, limit={}", wallet.getBalance(), limit);
            return ResponseEntity.ok(WalletResponse.from(wallet, ledgerService.getTransactions(customerId, limit)));
        } finally {
            MDC.remove(CorrelationContext.CUSTOMER_ID_MDC_KEY);
        }
    }
}

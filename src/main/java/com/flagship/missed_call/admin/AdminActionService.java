package com.flagship.missed_call.admin;

import com.flagship.missed_call.admin.dto.AdminActionRequest;
import com.flagship.missed_call.admin.dto.AdminActionResponse;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.customer.CustomerService;
import com.flagship.missed_call.wallet.LedgerPosting;
import com.flagship.missed_call.wallet.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Support actions on a customer account. Money only moves through the
 * wallet ledger, with the same idempotency rules as the pipeline.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminActionService {

    static final String CREDIT_DESCRIPTION = "Admin credit";
    static final String DEBIT_DESCRIPTION = "Admin debit";

    private final CustomerService customerService;
    private final WalletLedgerService ledgerService;

    public AdminActionResponse perform(AdminActionRequest request) {
        if (request == null || request.getCustomerId() == null) {
            throw new IllegalArgumentException("customer_id is required");
        }
        AdminAction action = AdminAction.fromValue(request.getAction());
        Customer customer = customerService.getById(request.getCustomerId());
        Map<String, Object> data = request.getData() != null ? request.getData() : Map.of();

        log.info("Admin action {} on customer {}", action.value(), customer.getId());
        return switch (action) {
            case ADD_WALLET_FUNDS -> walletResponse(action, ledgerService.credit(
                    customer.getId(), amount(data), description(data, CREDIT_DESCRIPTION), referenceId(data)));
            case DEDUCT_WALLET_FUNDS -> walletResponse(action, ledgerService.debit(
                    customer.getId(), amount(data), description(data, DEBIT_DESCRIPTION), referenceId(data)));
            case PAUSE -> statusResponse(action, customerService.setActive(customer.getId(), false));
            case RESUME -> statusResponse(action, customerService.setActive(customer.getId(), true));
        };
    }

    private static AdminActionResponse walletResponse(AdminAction action, LedgerPosting posting) {
        return AdminActionResponse.builder()
                .success(true)
                .customerId(posting.getCustomerId())
                .action(action.value())
                .balance(posting.getBalanceAfter())
                .transactionId(posting.getTransactionId())
                .replayed(posting.isReplayed())
                .build();
    }

    private static AdminActionResponse statusResponse(AdminAction action, Customer customer) {
        return AdminActionResponse.builder()
                .success(true)
                .customerId(customer.getId())
                .action(action.value())
                .active(customer.isActive())
                .build();
    }

    /**
     * Accepts a JSON number or a numeric string. Validity (positive, cents)
     * is checked by the ledger.
     */
    static BigDecimal amount(Map<String, Object> data) {
        Object raw = data.get("amount");
        if (raw == null) {
            throw new IllegalArgumentException("data.amount is required");
        }
        try {
            return new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("data.amount is not a number: " + raw);
        }
    }

    private static String referenceId(Map<String, Object> data) {
        Object raw = data.get("reference_id");
        return raw != null && !raw.toString().isBlank() ? raw.toString().trim() : null;
    }

    private static String description(Map<String, Object> data, String fallback) {
        Object raw = data.get("description");
        return raw != null && !raw.toString().isBlank() ? raw.toString().trim() : fallback;
    }
}

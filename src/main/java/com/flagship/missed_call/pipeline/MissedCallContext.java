package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.CallRecord;
import com.flagship.missed_call.callrecord.ResponseType;
import com.flagship.missed_call.channel.DeliveryReceipt;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.wallet.LedgerPosting;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * State threaded through the missed-call saga. Each step returns a copy with
 * its own result filled in; nothing here is persisted.
 */
@Value
@Builder(toBuilder = true)
public class MissedCallContext {
    MissedCallEvent event;
    Customer customer;
    CallerProfile caller;
    ResponseType responseType;
    BigDecimal cost;

    /** Ledger reference of the debit; the external event id unless an earlier charge was refunded. */
    String chargeReference;

    String responseText;
    DeliveryReceipt delivery;
    LedgerPosting debit;
    CallRecord record;
    @Singular("alertRaised")
    List<BigDecimal> alertsRaised;

    public String externalEventId() {
        return event.getExternalEventId();
    }

    public String chargeReference() {
        return chargeReference != null ? chargeReference : externalEventId();
    }
}

package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.CallRecord;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.wallet.LedgerPosting;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class ReplyContext {
    ReplyEvent event;
    Customer customer;
    CallRecord record;
    BigDecimal cost;
    LedgerPosting debit;
}

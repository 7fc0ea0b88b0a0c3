package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.config.MissedCallProperties;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.wallet.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Price of one missed call: the base price plus the paid features that
 * apply to it.
 *
 * Add-ons: sequences and two-way on every call, recognition for a repeat
 * caller, VIP priority (higher for a VIP caller), transcription whenever a
 * recording was left, after hours included.
 */
@Component
@RequiredArgsConstructor
public class CallPricing {

    private final MissedCallProperties properties;

    public BigDecimal priceFor(Customer customer, MissedCallEvent event, CallerProfile caller) {
        MissedCallProperties.Pricing pricing = properties.getPricing();
        BigDecimal total = pricing.getBasePrice();
        if (customer.isSequencesEnabled()) {
            total = total.add(pricing.getSequencesPrice());
        }
        if (customer.isRecognitionEnabled() && caller.isRepeatCaller()) {
            total = total.add(pricing.getRecognitionPrice());
        }
        if (customer.isTwoWayEnabled()) {
            total = total.add(pricing.getTwoWayPrice());
        }
        if (customer.isVipPriorityEnabled()) {
            total = total.add(caller.isVip() ? pricing.getVipPrice() : pricing.getVipPriorityPrice());
        }
        if (customer.isTranscriptionEnabled() && event.hasRecording()) {
            total = total.add(pricing.getTranscriptionPrice());
        }
        return Money.normalize(total);
    }

    public BigDecimal replyPrice() {
        return Money.normalize(properties.getPricing().getReplyPrice());
    }

    public BigDecimal minimumBalance() {
        return Money.normalize(properties.getPricing().getMinimumBalance());
    }
}

package com.gomflow.smartagent.domain;

import java.math.BigDecimal;

public record ManualCorrections(
        BigDecimal amount,
        String currency,
        String method,
        String reference
) {

    public boolean isEmpty() {
        return amount == null && currency == null && method == null && reference == null;
    }
}

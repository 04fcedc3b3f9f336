package com.example.pricing_import.standardize;

import java.math.BigDecimal;

/**
 * Outcome of parsing one raw price string.
 *
 * @param amount       fixed-point amount (scale at least 2), null on failure
 * @param currencyHint ISO code implied by a symbol or code in the text, may be null
 * @param failure      null on success
 */
public record ParsedPrice(BigDecimal amount, String currencyHint, Failure failure) {

    public enum Failure {
        UNPARSEABLE,
        NEGATIVE
    }

    static ParsedPrice of(BigDecimal amount, String currencyHint) {
        return new ParsedPrice(amount, currencyHint, null);
    }

    static ParsedPrice failed(Failure failure, String currencyHint) {
        return new ParsedPrice(null, currencyHint, failure);
    }

    public boolean isOk() {
        return failure == null;
    }
}

package com.racelisting.common.query;

public record OrderResult(String sql, OrderOutcome outcome) {

    static OrderResult unchanged(String baseQuery, OrderOutcome outcome) {
        return new OrderResult(baseQuery, outcome);
    }
}

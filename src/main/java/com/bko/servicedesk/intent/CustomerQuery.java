package com.bko.servicedesk.intent;

import org.springframework.lang.Nullable;

public record CustomerQuery(String text, CallerContext context) {

    public CustomerQuery(@Nullable String text, @Nullable CallerContext context) {
        this.text = text == null ? "" : text;
        this.context = context == null ? CallerContext.empty() : context;
    }

    public static CustomerQuery of(String text) {
        return new CustomerQuery(text, CallerContext.empty());
    }

    public static CustomerQuery of(String text, Long customerId) {
        return new CustomerQuery(text, CallerContext.forCustomer(customerId));
    }
}

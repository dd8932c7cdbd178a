package com.bank_ledger_sync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DateKey {
    @JsonProperty("bookingDate")
    BOOKING_DATE,
    @JsonProperty("valueDate")
    VALUE_DATE
}

package com.kotsin.ledger.model;

public enum FillSource {
    BROKERAGE,
    EXCHANGE
}

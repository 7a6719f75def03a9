package com.kotsin.ledger.grid;

@FunctionalInterface
public interface AccessTokenProvider {

    /** bearer token valid for at least the next remote call */
    String accessToken();
}

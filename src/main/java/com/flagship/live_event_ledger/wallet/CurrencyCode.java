package com.flagship.live_event_ledger.wallet;

/**
 * ISO-4217 currencies a wallet may hold. Transfers never convert: both
 * wallets of a transfer must share a currency.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    INR,
    JPY
}

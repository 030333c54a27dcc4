package org.nowstart.scalper.data.type;

/**
 * Canonical order state produced from VALR's order-status payloads, whatever field name or casing
 * the endpoint happened to use.
 */
public enum ExchangeOrderStatus {
    PENDING,
    FILLED,
    PARTIALLY_FILLED,
    CANCELLED
}

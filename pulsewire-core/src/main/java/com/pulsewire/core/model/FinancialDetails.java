package com.pulsewire.core.model;

/**
 * A quote or metric observation for one tracked symbol.
 */
public record FinancialDetails(
    String symbol,
    String entityName,
    String metricType,      // "stock_price", "market_cap", ...
    double value,
    Double changePct        // null when the source gives no change
) implements ItemDetails {

    @Override
    public ItemKind kind() {
        return ItemKind.FINANCIAL;
    }

    @Override
    public String matchText() {
        return (symbol != null ? symbol : "") + " " + (entityName != null ? entityName : "");
    }
}

package com.pulsewire.core.model;

/**
 * A merger, acquisition or investment announcement.
 */
public record DealDetails(
    String activityType,    // "acquisition", "investment", "merger"
    String acquirer,
    String target,
    Double dealValue,       // in currency units, null when undisclosed
    String dealValueText
) implements ItemDetails {

    @Override
    public ItemKind kind() {
        return ItemKind.DEAL;
    }

    @Override
    public String matchText() {
        return (acquirer != null ? acquirer : "") + " " + (target != null ? target : "");
    }
}

package com.pulsewire.core.model;

/**
 * An industry award result.
 */
public record AwardDetails(
    String awardShow,
    String category,
    String winner,
    String medal,       // "Grand Prix", "Gold", "Silver", "Bronze", "Shortlist"
    String campaign,
    int year
) implements ItemDetails {

    @Override
    public ItemKind kind() {
        return ItemKind.AWARD;
    }

    @Override
    public String matchText() {
        return (winner != null ? winner : "") + " " + (campaign != null ? campaign : "");
    }
}

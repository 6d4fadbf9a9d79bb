package com.pulsewire.core.model;

public record SocialDetails(
    String platform,
    String authorName,
    String authorHandle
) implements ItemDetails {

    @Override
    public ItemKind kind() {
        return ItemKind.SOCIAL;
    }

    @Override
    public String matchText() {
        return (authorName != null ? authorName : "") + " " + (authorHandle != null ? authorHandle : "");
    }
}

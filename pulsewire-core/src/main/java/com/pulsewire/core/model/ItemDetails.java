package com.pulsewire.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Variant-specific payload of an {@link Item}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "variant")
@JsonSubTypes({
    @JsonSubTypes.Type(value = NewsDetails.class, name = "news"),
    @JsonSubTypes.Type(value = FinancialDetails.class, name = "financial"),
    @JsonSubTypes.Type(value = SocialDetails.class, name = "social"),
    @JsonSubTypes.Type(value = AwardDetails.class, name = "award"),
    @JsonSubTypes.Type(value = DealDetails.class, name = "deal")
})
public sealed interface ItemDetails
    permits NewsDetails, FinancialDetails, SocialDetails, AwardDetails, DealDetails {

    /** The item kind this payload belongs to. */
    ItemKind kind();

    /** Extra text that relevance matching should see besides title and snippet. */
    default String matchText() {
        return "";
    }
}

package com.pulsewire.core.coordinator;

import com.pulsewire.core.config.Credentials;
import com.pulsewire.core.config.ProfileConfig;

import java.time.LocalDate;
import java.util.Objects;

/**
 * What to collect and how: profile, date window, credentials, selection and options.
 */
public record CollectionPlan(
    ProfileConfig profile,
    LocalDate fromDate,
    LocalDate toDate,
    Credentials credentials,
    CollectorSelection selection,
    CoordinatorOptions options
) {
    public CollectionPlan {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(fromDate, "fromDate");
        Objects.requireNonNull(toDate, "toDate");
        Objects.requireNonNull(options, "options");
        if (fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
        credentials = credentials != null ? credentials : Credentials.empty();
        selection = selection != null ? selection : CollectorSelection.all();
    }
}

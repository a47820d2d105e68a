package com.screening.engine.snapshot;

import com.screening.engine.ListEntry;
import com.screening.engine.ListSource;

import java.util.Arrays;
import java.util.List;

/**
 * Small built-in lists used when a snapshot cannot be loaded.
 *
 * Results computed from these are always marked as fallback; they only keep
 * the best-known names screened while the real list is missing.
 */
final class ReferenceLists {

    private static final List<ListEntry> OFAC = names(ListSource.OFAC,
            "Vladimir Putin",
            "Sergey Lavrov",
            "Kim Jong Un",
            "Nicolás Maduro",
            "Raúl Castro",
            "Bashar al-Assad");

    private static final List<ListEntry> UN_SECURITY_COUNCIL = names(ListSource.UN_SECURITY_COUNCIL,
            "Osama bin Laden",
            "Ayman al-Zawahiri");

    private static final List<ListEntry> DEREGISTERED = List.of(
            ListEntry.taxpayer("AAA010101AAA", null, "definitivo"),
            ListEntry.taxpayer("BBB020202BBB", null, "definitivo"),
            ListEntry.taxpayer("CCC030303CCC", null, "definitivo"),
            ListEntry.taxpayer("XXX000000XXX", null, "definitivo"));

    private ReferenceLists() {
    }

    static List<ListEntry> forSource(ListSource source) {
        return switch (source) {
            case OFAC -> OFAC;
            case UN_SECURITY_COUNCIL -> UN_SECURITY_COUNCIL;
            case DEREGISTERED_ENTITY -> DEREGISTERED;
            // No meaningful built-in data for domestic lists
            case DOMESTIC_BLOCKED, PEP -> List.of();
        };
    }

    private static List<ListEntry> names(ListSource source, String... names) {
        return Arrays.stream(names)
                .map(name -> ListEntry.named(source, name))
                .toList();
    }
}

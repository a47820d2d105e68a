package com.screening.engine;

import com.screening.engine.snapshot.ListSnapshot;
import com.screening.model.PersonType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NameTokenMatcher")
class NameTokenMatcherTest {

    private final NameTokenMatcher matcher = new NameTokenMatcher(ListSource.PEP, 10);

    private MatchResult match(String fullName, ListSnapshot snapshot) {
        IdentityRecord identity = IdentityRecord.of(PersonType.INDIVIDUAL, fullName, null);
        return matcher.match(identity, identity.normalizedName(), snapshot);
    }

    @Test
    @DisplayName("Should match a candidate containing every query token and skip one that does not")
    void shouldMatchConjunctively() {
        // Given
        ListSnapshot snapshot = ListSnapshot.of(ListSource.PEP, "v1", "Juan Perez Gomez", "Maria Lopez");

        // When
        MatchResult result = match("Juan Pérez", snapshot);

        // Then
        assertThat(result.found()).isTrue();
        assertThat(result.total()).isEqualTo(1);
        assertThat(result.entries()).extracting(MatchedEntry::name).containsExactly("Juan Perez Gomez");
        assertThat(result.error()).isNull();
        assertThat(result.provenance()).isEqualTo(Provenance.AUTHORITATIVE);
    }

    @Test
    @DisplayName("Should hit a blocked-persons entry for a name pasted with non-breaking spaces")
    void shouldMatchNameWithUnicodeSpaces() {
        // Given
        NameTokenMatcher blockedMatcher = new NameTokenMatcher(ListSource.DOMESTIC_BLOCKED, 10);
        ListSnapshot snapshot = ListSnapshot.of(ListSource.DOMESTIC_BLOCKED, "v1", "Juan Perez Gomez");
        IdentityRecord identity = IdentityRecord.of(PersonType.INDIVIDUAL, "Juan\u00A0Pérez", null);

        // When
        MatchResult result = blockedMatcher.match(identity, identity.normalizedName(), snapshot);

        // Then
        assertThat(identity.normalizedName().tokens()).containsExactly("juan", "perez");
        assertThat(result.found()).isTrue();
        assertThat(result.entries()).extracting(MatchedEntry::name).containsExactly("Juan Perez Gomez");
    }

    @Test
    @DisplayName("Should match regardless of token order")
    void shouldIgnoreTokenOrder() {
        ListSnapshot snapshot = ListSnapshot.of(ListSource.PEP, "v1", "Gomez Perez Juan");

        assertThat(match("Juan Pérez", snapshot).found()).isTrue();
    }

    @Test
    @DisplayName("Should match tokens as substrings of longer words")
    void shouldMatchSubstrings() {
        ListSnapshot snapshot = ListSnapshot.of(ListSource.PEP, "v1", "Juanita Perezgil");

        assertThat(match("Juan Pérez", snapshot).found()).isTrue();
    }

    @Test
    @DisplayName("Should never match a candidate sharing no token with the query")
    void shouldNotMatchUnrelatedNames() {
        ListSnapshot snapshot = ListSnapshot.of(ListSource.PEP, "v1", "Maria Lopez", "Carlos Ramirez");

        MatchResult result = match("Juan Pérez", snapshot);

        assertThat(result.found()).isFalse();
        assertThat(result.total()).isZero();
        assertThat(result.entries()).isEmpty();
        assertThat(result.error()).isNull();
    }

    @Test
    @DisplayName("Should cap returned entries but report the full total")
    void shouldCapEntries() {
        // Given
        String[] names = IntStream.rangeClosed(1, 12)
                .mapToObj(i -> "Juan Perez " + i)
                .toArray(String[]::new);
        ListSnapshot snapshot = ListSnapshot.of(ListSource.PEP, "v1", names);

        // When
        MatchResult result = match("Juan Perez", snapshot);

        // Then
        assertThat(result.total()).isEqualTo(12);
        assertThat(result.entries()).hasSize(10);
        assertThat(result.entries().get(0).name()).isEqualTo("Juan Perez 1");
    }

    @Test
    @DisplayName("Should treat a name without long tokens as unmatchable, not as matching everything")
    void shouldNotMatchEverythingWithoutTokens() {
        ListSnapshot snapshot = ListSnapshot.of(ListSource.PEP, "v1", "Al Li", "Alberto Lima");

        MatchResult result = match("Al Li", snapshot);

        assertThat(result.found()).isFalse();
        assertThat(result.note()).isEqualTo(NameTokenMatcher.UNMATCHABLE_NOTE);
    }

    @Test
    @DisplayName("Should report an unavailable snapshot as an error, not as a clean result")
    void shouldReportUnavailableSource() {
        ListSnapshot snapshot = ListSnapshot.unavailable(ListSource.PEP, "snapshot file not found: pep.json");

        MatchResult result = match("Juan Pérez", snapshot);

        assertThat(result.found()).isFalse();
        assertThat(result.error()).isEqualTo("PEPs unavailable: snapshot file not found: pep.json");
        assertThat(result.provenance()).isEqualTo(Provenance.UNAVAILABLE);
        assertThat(result.isAuthoritative()).isFalse();
    }

    @Test
    @DisplayName("Should mark results computed from the fallback list")
    void shouldMarkFallbackResults() {
        // Given
        ListSnapshot snapshot = ListSnapshot.fallback(ListSource.PEP, "snapshot file is malformed: pep.json",
                List.of(ListEntry.named(ListSource.PEP, "Juan Perez Gomez")));

        // When
        MatchResult result = match("Juan Pérez", snapshot);

        // Then
        assertThat(result.found()).isTrue();
        assertThat(result.provenance()).isEqualTo(Provenance.FALLBACK);
        assertThat(result.note()).isEqualTo("fallback reference list used (snapshot file is malformed: pep.json)");
        assertThat(result.isAuthoritative()).isFalse();
    }

    @Test
    @DisplayName("Should refuse a snapshot of another source")
    void shouldRejectForeignSnapshot() {
        ListSnapshot snapshot = ListSnapshot.of(ListSource.OFAC, "v1", "Juan Perez");

        MatchResult result = match("Juan Pérez", snapshot);

        assertThat(result.found()).isFalse();
        assertThat(result.error()).isNotNull();
    }
}

package com.racelisting.common.status;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatusAnnotatorTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final Instant FUTURE = NOW.plus(Duration.ofHours(24));
    private static final Instant PAST = NOW.minus(Duration.ofHours(24));

    private final StatusAnnotator<Listing> annotator =
            new StatusAnnotator<>(Clock.fixed(NOW, ZoneOffset.UTC));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Listing implements ScheduledListing {
        private Instant advertisedStartTime;
        private String status = "";
        private String label;

        Listing(Instant advertisedStartTime) {
            this.advertisedStartTime = advertisedStartTime;
        }
    }

    private static List<Listing> listings(Instant... starts) {
        List<Listing> result = new ArrayList<>();
        for (Instant start : starts) {
            result.add(new Listing(start));
        }
        return result;
    }

    private static List<String> statuses(List<Listing> listings) {
        return listings.stream().map(Listing::getStatus).toList();
    }

    @Test
    void nullInputGivesNull() {
        assertThat(annotator.annotate(null)).isNull();
    }

    @Test
    void emptyInputGivesSameEmptyList() {
        List<Listing> empty = new ArrayList<>();

        assertThat(annotator.annotate(empty)).isSameAs(empty).isEmpty();
    }

    @Test
    void futureStartIsOpen() {
        assertThat(statuses(annotator.annotate(listings(FUTURE)))).containsExactly("OPEN");
    }

    @Test
    void pastStartIsClosed() {
        assertThat(statuses(annotator.annotate(listings(PAST)))).containsExactly("CLOSED");
    }

    @Test
    void startExactlyNowIsClosed() {
        assertThat(statuses(annotator.annotate(listings(NOW)))).containsExactly("CLOSED");
    }

    @Test
    void startOneNanosecondAheadIsOpen() {
        assertThat(statuses(annotator.annotate(listings(NOW.plusNanos(1))))).containsExactly("OPEN");
    }

    @Test
    void missingStartKeepsEmptyStatus() {
        assertThat(statuses(annotator.annotate(listings((Instant) null)))).containsExactly("");
    }

    @Test
    void mixedBatchResolvesEachEntityIndependently() {
        List<Listing> input = listings(FUTURE, PAST, null, FUTURE, NOW);

        List<Listing> result = annotator.annotate(input);

        assertThat(result).isSameAs(input);
        assertThat(statuses(result)).containsExactly("OPEN", "CLOSED", "", "OPEN", "CLOSED");
    }

    @Test
    void statusIsRecomputedOnEveryCall() {
        Listing listing = new Listing(NOW.plusSeconds(30));
        List<Listing> batch = List.of(listing);

        new StatusAnnotator<Listing>(Clock.fixed(NOW, ZoneOffset.UTC)).annotate(batch);
        assertThat(listing.getStatus()).isEqualTo("OPEN");

        new StatusAnnotator<Listing>(Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC)).annotate(batch);
        assertThat(listing.getStatus()).isEqualTo("CLOSED");
    }

    @Test
    void derivedFieldsRunForEveryEntityEvenWithoutStart() {
        DerivedField<Listing> label = listing -> listing.setLabel("seen");
        StatusAnnotator<Listing> withLabel =
                new StatusAnnotator<Listing>(Clock.fixed(NOW, ZoneOffset.UTC), List.of(label));

        List<Listing> result = withLabel.annotate(listings(FUTURE, null));

        assertThat(result).extracting(Listing::getLabel).containsExactly("seen", "seen");
        assertThat(statuses(result)).containsExactly("OPEN", "");
    }

    @Test
    void statusAtComparesStrictly() {
        assertThat(StatusAnnotator.statusAt(FUTURE, NOW)).isEqualTo(ListingStatus.OPEN);
        assertThat(StatusAnnotator.statusAt(PAST, NOW)).isEqualTo(ListingStatus.CLOSED);
        assertThat(StatusAnnotator.statusAt(NOW, NOW)).isEqualTo(ListingStatus.CLOSED);
    }
}

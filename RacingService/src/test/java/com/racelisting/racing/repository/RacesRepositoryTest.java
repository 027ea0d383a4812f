package com.racelisting.racing.repository;

import com.racelisting.common.catalog.SqliteColumnCatalog;
import com.racelisting.common.config.ListingDatabase;
import com.racelisting.common.config.ListingProperties;
import com.racelisting.common.exception.ListingNotFoundException;
import com.racelisting.common.exception.ListingQueryException;
import com.racelisting.common.query.OrderOutcome;
import com.racelisting.common.query.OrderSpec;
import com.racelisting.racing.dto.RaceFilter;
import com.racelisting.racing.model.Race;
import org.javalite.activejdbc.Base;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RacesRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @TempDir
    Path tempDir;

    private ListingDatabase database;
    private ListingProperties properties;
    private RacesRepository repository;

    @BeforeEach
    void setUp() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("racing.db"));
        database = new ListingDatabase(dataSource);

        properties = new ListingProperties();
        repository = new RacesRepository(database, new SqliteColumnCatalog(database), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));

        database.runWithConnection(() -> {
            Base.exec(RaceQueries.CREATE_TABLE);
            insert(1, 1, "Golden Cup", 1, 1, "2026-10-19T13:00:00Z");
            insert(2, 2, "Silver Plate", 2, 1, "2026-10-19T11:00:00Z");
            insert(3, 2, "Royal Mile", 3, 0, "2026-10-20T09:00:00Z");
            insert(4, 5, "City Sprint", 4, 1, "2026-10-19T12:00:00Z");
        });
    }

    private static void insert(long id, long meetingId, String name, int number, int visible, String start) {
        Base.exec(RaceQueries.INSERT, id, meetingId, name, number, visible, start);
    }

    private static List<Long> ids(List<Race> races) {
        return races.stream().map(Race::getId).toList();
    }

    @Test
    void listsEverythingWithoutFilterOrOrder() {
        assertThat(ids(repository.list(null, null))).containsExactlyInAnyOrder(1L, 2L, 3L, 4L);
    }

    @Test
    @DisplayName("meeting ids [1,2] with visible=true returns only visible races of those meetings")
    void filtersByMeetingAndVisibility() {
        RaceFilter filter = RaceFilter.builder().meetingIds(List.of(1L, 2L)).visible(true).build();

        assertThat(ids(repository.list(filter, null))).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void filtersHiddenRaces() {
        RaceFilter filter = RaceFilter.builder().visible(false).build();

        assertThat(ids(repository.list(filter, null))).containsExactly(3L);
    }

    @Test
    void ordersByRequestedColumnAndDirection() {
        List<Race> races = repository.list(null, OrderSpec.of("meeting_id", "DESC"));

        assertThat(races).extracting(Race::getMeetingId).containsExactly(5L, 2L, 2L, 1L);
    }

    @Test
    void ordersByDefaultFieldWhenOnlyDirectionGiven() {
        List<Race> races = repository.list(null, OrderSpec.of(null, "asc"));

        assertThat(ids(races)).containsExactly(2L, 4L, 1L, 3L);
    }

    @Test
    @DisplayName("unknown sort field is ignored and the listing still succeeds")
    void unknownSortFieldIgnored() {
        OrderSpec order = OrderSpec.of("nonexistent", "ASC");

        assertThat(repository.getOrderCompiler().resolve(RaceQueries.LIST, order).outcome())
                .isEqualTo(OrderOutcome.SKIPPED_INVALID_FIELD);
        assertThat(repository.list(null, order)).hasSize(4);
    }

    @Test
    void injectionThroughSortFieldIsRejected() {
        OrderSpec order = OrderSpec.of("id; DROP TABLE races", null);

        assertThat(repository.list(null, order)).hasSize(4);
        assertThat(repository.list(null, null)).hasSize(4);
    }

    @Test
    void annotatesStatusAgainstClock() {
        List<Race> races = repository.list(null, OrderSpec.of("id", "ASC"));

        assertThat(races).extracting(Race::getStatus).containsExactly("OPEN", "CLOSED", "OPEN", "CLOSED");
    }

    @Test
    void getByIdReturnsAnnotatedRace() {
        Race race = repository.getById(3);

        assertThat(race.getName()).isEqualTo("Royal Mile");
        assertThat(race.getMeetingId()).isEqualTo(2L);
        assertThat(race.getNumber()).isEqualTo(3);
        assertThat(race.isVisible()).isFalse();
        assertThat(race.getAdvertisedStartTime()).isEqualTo(Instant.parse("2026-10-20T09:00:00Z"));
        assertThat(race.getStatus()).isEqualTo("OPEN");
    }

    @Test
    void getByIdMissingRaceIsNotFound() {
        assertThatThrownBy(() -> repository.getById(999))
                .isInstanceOf(ListingNotFoundException.class)
                .hasMessage("Unable to locate a race with the provided ID: 999");
    }

    @Test
    void queryFailureSurfacesAsListingQueryException() {
        database.runWithConnection(() -> Base.exec("DROP TABLE races"));

        assertThatThrownBy(() -> repository.list(null, null))
                .isInstanceOf(ListingQueryException.class);
    }

    @Test
    void connectionIsReleasedAfterEachCall() {
        repository.list(null, OrderSpec.of("name", "ASC"));

        assertThat(Base.hasConnection()).isFalse();
    }

    @Test
    void seedsOnlyOnce() {
        properties.getSeed().setRows(20);
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("seeded.db"));
        ListingDatabase seededDatabase = new ListingDatabase(dataSource);
        RacesRepository seeded = new RacesRepository(seededDatabase, new SqliteColumnCatalog(seededDatabase),
                properties, Clock.fixed(NOW, ZoneOffset.UTC));

        seeded.init();
        seededDatabase.runWithConnection(() -> Base.exec("DELETE FROM races WHERE id > 10"));
        seeded.init();

        List<Race> races = seeded.list(null, null);
        assertThat(races).hasSize(10);
        assertThat(races).allSatisfy(race -> {
            assertThat(race.getMeetingId()).isBetween(1L, 10L);
            assertThat(race.getNumber()).isBetween(1, 12);
            assertThat(race.getAdvertisedStartTime())
                    .isBetween(NOW.minusSeconds(86_400), NOW.plusSeconds(2 * 86_400));
            assertThat(race.getStatus()).isIn("OPEN", "CLOSED");
        });
    }
}

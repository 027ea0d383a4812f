package com.racelisting.sports.repository;

import com.racelisting.common.catalog.ColumnCatalog;
import com.racelisting.common.config.ListingConfig;
import com.racelisting.common.config.ListingDatabase;
import com.racelisting.common.config.ListingProperties;
import com.racelisting.common.repository.ListingRepository;
import com.racelisting.common.repository.Rows;
import com.racelisting.common.seed.DemoData;
import com.racelisting.common.status.StatusAnnotator;
import com.racelisting.sports.model.Event;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Repository
@Slf4j
public class EventsRepository extends ListingRepository<Event> {

    private static final List<String> TEAMS = List.of(
            "Bulls", "Heat", "Lakers", "Celtics", "Knicks", "Warriors", "Suns", "Bucks",
            "Raptors", "Nuggets", "Spurs", "Jazz", "Hawks", "Magic", "Kings", "Pistons");
    private static final List<String> VENUES = List.of(
            "New South Wales", "Victoria", "Queensland", "Western Australia", "South Australia",
            "Tasmania", "Northern Territory", "Australian Capital Territory");

    private final Clock clock;
    private final int seedRows;

    public EventsRepository(ListingDatabase database, ColumnCatalog columnCatalog,
                            ListingProperties properties, Clock clock) {
        super(database,
                ListingConfig.orderCompiler(columnCatalog, EventQueries.TABLE, properties),
                new StatusAnnotator<Event>(clock, List.of(Event.DISPLAY_NAME)));
        this.clock = clock;
        this.seedRows = properties.getSeed().getRows();
    }

    @Override
    protected String entityName() {
        return "event";
    }

    @Override
    protected String listQuery() {
        return EventQueries.LIST;
    }

    @Override
    protected Event mapRow(Map<String, Object> row) {
        return Event.builder()
                .id(Rows.getLong(row, "id"))
                .homeTeam(Rows.getString(row, "home_team"))
                .awayTeam(Rows.getString(row, "away_team"))
                .venueLocation(Rows.getString(row, "venue_location"))
                .visible(Rows.getBoolean(row, "visible"))
                .advertisedStartTime(Rows.getInstant(row, "advertised_start_time"))
                .build();
    }

    @Override
    protected void seed() {
        Base.exec(EventQueries.CREATE_TABLE);

        Base.openTransaction();
        try {
            for (int i = 1; i <= seedRows; i++) {
                Base.exec(EventQueries.INSERT,
                        i,
                        DemoData.pick(TEAMS),
                        DemoData.pick(TEAMS),
                        DemoData.pick(VENUES),
                        DemoData.between(0, 1),
                        DemoData.startTime(clock));
            }
            Base.commitTransaction();
        } catch (RuntimeException e) {
            Base.rollbackTransaction();
            throw e;
        }
        log.info("Seeded up to {} events", seedRows);
    }
}

package com.racelisting.racing.repository;

import com.racelisting.common.catalog.ColumnCatalog;
import com.racelisting.common.config.ListingConfig;
import com.racelisting.common.config.ListingDatabase;
import com.racelisting.common.config.ListingProperties;
import com.racelisting.common.repository.ListingRepository;
import com.racelisting.common.repository.Rows;
import com.racelisting.common.seed.DemoData;
import com.racelisting.common.status.StatusAnnotator;
import com.racelisting.racing.model.Race;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Repository
@Slf4j
public class RacesRepository extends ListingRepository<Race> {

    private static final List<String> NAME_PREFIXES = List.of(
            "Golden", "Silver", "Royal", "Autumn", "Spring", "Coastal", "Northern", "Grand", "Summer", "City");
    private static final List<String> NAME_SUFFIXES = List.of(
            "Cup", "Stakes", "Handicap", "Plate", "Classic", "Mile", "Sprint", "Derby", "Guineas", "Trophy");

    private final Clock clock;
    private final int seedRows;

    public RacesRepository(ListingDatabase database, ColumnCatalog columnCatalog,
                           ListingProperties properties, Clock clock) {
        super(database,
                ListingConfig.orderCompiler(columnCatalog, RaceQueries.TABLE, properties),
                new StatusAnnotator<>(clock));
        this.clock = clock;
        this.seedRows = properties.getSeed().getRows();
    }

    @Override
    protected String entityName() {
        return "race";
    }

    @Override
    protected String listQuery() {
        return RaceQueries.LIST;
    }

    @Override
    protected Race mapRow(Map<String, Object> row) {
        return Race.builder()
                .id(Rows.getLong(row, "id"))
                .meetingId(Rows.getLong(row, "meeting_id"))
                .name(Rows.getString(row, "name"))
                .number(Rows.getInteger(row, "number"))
                .visible(Rows.getBoolean(row, "visible"))
                .advertisedStartTime(Rows.getInstant(row, "advertised_start_time"))
                .build();
    }

    @Override
    protected void seed() {
        Base.exec(RaceQueries.CREATE_TABLE);

        Base.openTransaction();
        try {
            for (int i = 1; i <= seedRows; i++) {
                Base.exec(RaceQueries.INSERT,
                        i,
                        DemoData.between(1, 10),
                        DemoData.pick(NAME_PREFIXES) + " " + DemoData.pick(NAME_SUFFIXES),
                        DemoData.between(1, 12),
                        DemoData.between(0, 1),
                        DemoData.startTime(clock));
            }
            Base.commitTransaction();
        } catch (RuntimeException e) {
            Base.rollbackTransaction();
            throw e;
        }
        log.info("Seeded up to {} races", seedRows);
    }
}

package com.racelisting.sports.repository;

final class EventQueries {

    static final String TABLE = "events";

    static final String LIST =
            "SELECT id, home_team, away_team, venue_location, visible, advertised_start_time FROM events";

    static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS events (id INTEGER PRIMARY KEY, home_team TEXT, away_team TEXT, " +
            "venue_location TEXT, visible INTEGER, advertised_start_time DATETIME)";

    static final String INSERT =
            "INSERT OR IGNORE INTO events(id, home_team, away_team, venue_location, visible, advertised_start_time) " +
            "VALUES (?,?,?,?,?,?)";

    private EventQueries() {
    }
}

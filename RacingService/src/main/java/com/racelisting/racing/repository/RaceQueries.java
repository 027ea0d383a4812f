package com.racelisting.racing.repository;

final class RaceQueries {

    static final String TABLE = "races";

    static final String LIST =
            "SELECT id, meeting_id, name, number, visible, advertised_start_time FROM races";

    static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS races (id INTEGER PRIMARY KEY, meeting_id INTEGER, name TEXT, " +
            "number INTEGER, visible INTEGER, advertised_start_time DATETIME)";

    static final String INSERT =
            "INSERT OR IGNORE INTO races(id, meeting_id, name, number, visible, advertised_start_time) " +
            "VALUES (?,?,?,?,?,?)";

    private RaceQueries() {
    }
}

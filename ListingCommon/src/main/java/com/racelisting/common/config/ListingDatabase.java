package com.racelisting.common.config;

import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.function.Supplier;

/**
 * ActiveJDBC access to the listing store.
 *
 * Connections are taken from the pooled DataSource and attached to the
 * calling thread only for the duration of one unit of work, so concurrent
 * requests never share a connection.
 */
@Component
@Slf4j
public class ListingDatabase {

    private final DataSource dataSource;

    public ListingDatabase(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Runs {@code work} with a connection bound to the current thread.
     * Reuses a connection already opened further up the call stack and only
     * returns to the pool the connection it opened itself.
     */
    public <T> T withConnection(Supplier<T> work) {
        boolean opened = openConnection();
        try {
            return work.get();
        } finally {
            if (opened) {
                closeConnection();
            }
        }
    }

    public void runWithConnection(Runnable work) {
        withConnection(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Opens a connection for the current thread if none is attached yet.
     *
     * @return true when this call opened the connection
     */
    public boolean openConnection() {
        if (Base.hasConnection()) {
            return false;
        }
        Base.open(dataSource);
        log.trace("Listing store connection attached to thread {}", Thread.currentThread().getName());
        return true;
    }

    /**
     * Returns the current thread's connection to the pool.
     */
    public void closeConnection() {
        if (Base.hasConnection()) {
            Base.close();
            log.trace("Listing store connection released by thread {}", Thread.currentThread().getName());
        }
    }
}

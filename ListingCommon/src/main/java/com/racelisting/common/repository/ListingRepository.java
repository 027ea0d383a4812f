package com.racelisting.common.repository;

import com.racelisting.common.config.ListingDatabase;
import com.racelisting.common.exception.ListingNotFoundException;
import com.racelisting.common.exception.ListingQueryException;
import com.racelisting.common.query.CompiledQuery;
import com.racelisting.common.query.FilterCompiler;
import com.racelisting.common.query.FilterCondition;
import com.racelisting.common.query.ListingFilter;
import com.racelisting.common.query.OrderCompiler;
import com.racelisting.common.query.OrderSpec;
import com.racelisting.common.seed.OneTimeInitializer;
import com.racelisting.common.status.ScheduledListing;
import com.racelisting.common.status.StatusAnnotator;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read access to one listing table.
 *
 * A listing runs sequentially: filter compilation, the column catalog lookup
 * done by the order compiler, the main query, then the read-time annotation.
 * Subclasses supply the table specifics.
 */
@Slf4j
public abstract class ListingRepository<T extends ScheduledListing> {

    protected static final String ID_COLUMN = "id";

    protected final ListingDatabase database;
    private final OrderCompiler orderCompiler;
    private final StatusAnnotator<T> annotator;
    private final OneTimeInitializer initializer = new OneTimeInitializer();

    protected ListingRepository(ListingDatabase database,
                                OrderCompiler orderCompiler,
                                StatusAnnotator<T> annotator) {
        this.database = database;
        this.orderCompiler = orderCompiler;
        this.annotator = annotator;
    }

    /** Singular entity name used in messages, e.g. "race". */
    protected abstract String entityName();

    /** Select over the persisted columns, without any trailing clause. */
    protected abstract String listQuery();

    protected abstract T mapRow(Map<String, Object> row);

    /** Creates the table and inserts demonstration rows if they are missing. */
    protected abstract void seed();

    /**
     * Prepares the table. Only the first call in the process does any work.
     */
    public void init() {
        if (initializer.runOnce(() -> database.runWithConnection(this::seed))) {
            log.info("Initialised {} listing store", entityName());
        }
    }

    public List<T> list(ListingFilter filter, OrderSpec order) {
        CompiledQuery filtered = FilterCompiler.compile(listQuery(), filter);
        String sql = orderCompiler.compile(filtered.sql(), order);

        List<T> entities = query(sql, filtered.arguments());
        return annotator.annotate(entities);
    }

    /**
     * @throws ListingNotFoundException when no row has the given id
     */
    public T getById(long id) {
        ListingFilter byId = () -> List.of(FilterCondition.equalTo(ID_COLUMN, id));
        CompiledQuery query = FilterCompiler.compile(listQuery(), byId);

        List<T> entities = annotator.annotate(query(query.sql(), query.arguments()));
        if (entities.isEmpty()) {
            throw new ListingNotFoundException(entityName(), id);
        }
        return entities.get(0);
    }

    private List<T> query(String sql, List<Object> params) {
        log.debug("Listing {}: {} {}", entityName(), sql, params);

        List<Map<String, Object>> rows;
        try {
            rows = database.withConnection(() -> {
                @SuppressWarnings("unchecked")
                List<Map<String, Object>> found = (List<Map<String, Object>>) (List<?>) Base.findAll(sql, params.toArray());
                return found;
            });
        } catch (RuntimeException e) {
            throw new ListingQueryException("Failed to query " + entityName() + " listings: " + e.getMessage(), e);
        }

        List<T> entities = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            entities.add(mapRow(row));
        }
        return entities;
    }

    public OrderCompiler getOrderCompiler() {
        return orderCompiler;
    }
}

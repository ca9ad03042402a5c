package fun.fengwk.snow.core.facade.store;

import fun.fengwk.snow.core.facade.store.model.StoreResponse;

import java.util.Map;

/**
 * Table store operations, each independent and never throwing.
 *
 * @author fengwk
 */
public interface StoreFacade {

    /**
     * Delete every row whose {@code field} equals {@code value}.
     */
    StoreResponse delete(String table, String field, String value);

    /**
     * Insert one row, keys are column names.
     */
    StoreResponse insert(String table, Map<String, Object> row);

}

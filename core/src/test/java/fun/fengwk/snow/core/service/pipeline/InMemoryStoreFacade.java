package fun.fengwk.snow.core.service.pipeline;

import fun.fengwk.snow.core.facade.store.StoreFacade;
import fun.fengwk.snow.core.facade.store.model.StoreResponse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table store kept in memory, recording every call in order.
 *
 * @author fengwk
 */
public class InMemoryStoreFacade implements StoreFacade {

    final List<String> calls = new ArrayList<>();
    final Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
    final Set<String> failDeletesFor = new HashSet<>();
    final Set<String> failInsertsFor = new HashSet<>();
    final Set<String> throwOnDeleteFor = new HashSet<>();

    @Override
    public synchronized StoreResponse delete(String table, String field, String value) {
        calls.add("delete:" + value);
        if (throwOnDeleteFor.contains(value)) {
            throw new IllegalStateException("store unavailable");
        }
        if (failDeletesFor.contains(value)) {
            return StoreResponse.builder().statusCode(500).error("delete rejected").build();
        }
        rows(table).removeIf(row -> Objects.equals(row.get(field), value));
        return StoreResponse.builder().statusCode(204).build();
    }

    @Override
    public synchronized StoreResponse insert(String table, Map<String, Object> row) {
        Object name = row.get("Ski Resort");
        calls.add("insert:" + name);
        if (failInsertsFor.contains(String.valueOf(name))) {
            return StoreResponse.builder().statusCode(400).error("insert rejected").build();
        }
        rows(table).add(new LinkedHashMap<>(row));
        return StoreResponse.builder().statusCode(201).build();
    }

    synchronized List<Map<String, Object>> rows(String table) {
        return tables.computeIfAbsent(table, key -> new ArrayList<>());
    }

}

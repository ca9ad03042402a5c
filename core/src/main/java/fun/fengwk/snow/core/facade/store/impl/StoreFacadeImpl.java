package fun.fengwk.snow.core.facade.store.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.snow.core.facade.store.StoreFacade;
import fun.fengwk.snow.core.facade.store.model.StoreResponse;
import fun.fengwk.snow.core.facade.store.supabase.SupabaseClient;
import fun.fengwk.snow.core.facade.store.supabase.SupabaseClientResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class StoreFacadeImpl implements StoreFacade {

    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final SupabaseClient supabaseClient;
    private final ObjectMapper objectMapper;

    @Override
    public StoreResponse delete(String table, String field, String value) {
        if (!StringUtils.hasText(table) || !StringUtils.hasText(field) || value == null) {
            return StoreResponse.builder().error("table, field and value are required").build();
        }
        return toStoreResponse(supabaseClient.deleteEq(table, field, value));
    }

    @Override
    public StoreResponse insert(String table, Map<String, Object> row) {
        if (!StringUtils.hasText(table) || row == null || row.isEmpty()) {
            return StoreResponse.builder().error("table and row are required").build();
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(row);
        } catch (Exception ex) {
            return StoreResponse.builder().error("row serialization failed: " + ex.getMessage()).build();
        }
        return toStoreResponse(supabaseClient.insert(table, json));
    }

    private StoreResponse toStoreResponse(SupabaseClientResponse response) {
        StoreResponse.StoreResponseBuilder builder = StoreResponse.builder()
            .statusCode(response.getStatusCode());
        if (response.hasError()) {
            Throwable error = response.getError();
            return builder.error(error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage())
                .build();
        }
        if (response.getStatusCode() < 200 || response.getStatusCode() >= 300) {
            return builder.error("store returned status " + response.getStatusCode() + ": " + abbreviate(response.getBody()))
                .build();
        }
        return builder.build();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }

}

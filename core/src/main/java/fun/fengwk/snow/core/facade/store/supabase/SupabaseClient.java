package fun.fengwk.snow.core.facade.store.supabase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Supabase PostgREST HTTP client.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SupabaseClient {

    private static final String REST_PATH = "/rest/v1/";

    private final SupabaseProperties properties;
    private final HttpClient httpClient;

    /**
     * DELETE rows where {@code field = value}.
     */
    public SupabaseClientResponse deleteEq(String table, String field, String value) {
        String query = encode(field) + "=" + encode("eq." + value);
        return send(newRequest(table, query).DELETE());
    }

    /**
     * POST one json row.
     */
    public SupabaseClientResponse insert(String table, String jsonRow) {
        return send(newRequest(table, null)
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(jsonRow, StandardCharsets.UTF_8)));
    }

    private HttpRequest.Builder newRequest(String table, String queryString) {
        return HttpRequest.newBuilder()
            .uri(buildUri(table, queryString))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("apikey", properties.getServiceKey())
            .header("Authorization", "Bearer " + properties.getServiceKey())
            .header("Accept", "application/json")
            .header("Prefer", "return=minimal");
    }

    private SupabaseClientResponse send(HttpRequest.Builder builder) {
        HttpRequest request;
        try {
            request = builder.build();
        } catch (Exception ex) {
            return SupabaseClientResponse.builder().error(ex).build();
        }
        try {
            HttpResponse<String> response = httpClient.send(request, BodyHandlers.ofString(StandardCharsets.UTF_8));
            return SupabaseClientResponse.builder()
                .statusCode(response.statusCode())
                .body(response.body())
                .build();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return SupabaseClientResponse.builder().error(ex).build();
        } catch (Exception ex) {
            log.debug("supabase request failed, method={}, uri={}, error={}", request.method(), request.uri(), ex.getMessage());
            return SupabaseClientResponse.builder().error(ex).build();
        }
    }

    private URI buildUri(String table, String queryString) {
        String baseUrl = StringUtils.hasText(properties.getUrl())
            ? properties.getUrl().trim()
            : "";
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String path = baseUrl + REST_PATH + encode(table);
        if (!StringUtils.hasText(queryString)) {
            return URI.create(path);
        }
        return URI.create(path + "?" + queryString);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }

}

package fun.fengwk.snow.core.facade.store.supabase;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Supabase configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "snow.store.supabase")
public class SupabaseProperties {

    /**
     * Project url, e.g. https://xyz.supabase.co.
     */
    private String url = "";

    /**
     * Service role key, sent both as apikey and bearer token.
     */
    private String serviceKey = "";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 10000;

}

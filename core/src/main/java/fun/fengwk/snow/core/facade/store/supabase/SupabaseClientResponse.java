package fun.fengwk.snow.core.facade.store.supabase;

import lombok.Builder;
import lombok.Data;

/**
 * Raw response from the Supabase REST api.
 *
 * @author fengwk
 */
@Data
@Builder
public class SupabaseClientResponse {

    private int statusCode;
    private String body;
    private Throwable error;

    public boolean hasError() {
        return error != null;
    }

}

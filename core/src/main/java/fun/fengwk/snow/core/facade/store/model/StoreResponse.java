package fun.fengwk.snow.core.facade.store.model;

import lombok.Builder;
import lombok.Data;

/**
 * Acknowledgement of one store operation.
 *
 * @author fengwk
 */
@Data
@Builder
public class StoreResponse {

    /**
     * HTTP status code from the store, 0 when no response was received.
     */
    private int statusCode;

    /**
     * Error message, null on success.
     */
    private String error;

    public boolean isSuccess() {
        return error == null;
    }

}

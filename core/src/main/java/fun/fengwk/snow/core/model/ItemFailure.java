package fun.fengwk.snow.core.model;

import lombok.Value;

/**
 * @author fengwk
 */
@Value
public class ItemFailure {

    FailureKind kind;
    String message;

    public static ItemFailure of(FailureKind kind, String message) {
        return new ItemFailure(kind, message == null ? kind.name().toLowerCase() : message);
    }

}

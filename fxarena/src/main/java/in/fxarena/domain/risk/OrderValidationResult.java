package in.fxarena.domain.risk;

/**
 * Outcome of an order or exit-level check. {@code rejection} and
 * {@code error} are null when valid.
 */
public record OrderValidationResult(boolean valid, OrderRejection rejection, String error) {

    private static final OrderValidationResult OK = new OrderValidationResult(true, null, null);

    public static OrderValidationResult ok() {
        return OK;
    }

    public static OrderValidationResult reject(OrderRejection rejection, String error) {
        return new OrderValidationResult(false, rejection, error);
    }
}

package in.fxarena.infrastructure.feed;

/**
 * Thrown when the streaming feed connection cannot be established or is lost.
 */
public class FeedConnectionException extends RuntimeException {

    private final String endpoint;

    public FeedConnectionException(String endpoint, String message) {
        super(String.format("[FEED:%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public FeedConnectionException(String endpoint, String message, Throwable cause) {
        super(String.format("[FEED:%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}

package in.fxarena.infrastructure.feed;

/**
 * Callbacks for one feed connection. {@link #onText} receives complete
 * messages only; fragments are joined by the connector.
 */
public interface FeedSessionListener {

    void onOpen(FeedSession session);

    void onText(String text);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}

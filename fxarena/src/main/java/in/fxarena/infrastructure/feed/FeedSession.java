package in.fxarena.infrastructure.feed;

/**
 * An open connection to the market-data feed.
 */
public interface FeedSession {

    void send(String text);

    void close();
}

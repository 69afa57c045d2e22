package in.fxarena.infrastructure.feed;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens feed connections. The returned future completes once the socket is
 * open, or exceptionally with a {@link FeedConnectionException}.
 */
public interface FeedConnector {

    CompletableFuture<FeedSession> connect(URI uri, FeedSessionListener listener);
}

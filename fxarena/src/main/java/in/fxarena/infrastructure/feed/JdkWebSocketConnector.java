package in.fxarena.infrastructure.feed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Feed connector on the JDK WebSocket client.
 */
public final class JdkWebSocketConnector implements FeedConnector {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;

    public JdkWebSocketConnector(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public CompletableFuture<FeedSession> connect(URI uri, FeedSessionListener listener) {
        log.info("[STREAM] Connecting to {}", uri.getHost());
        AtomicReference<FeedSession> sessionRef = new AtomicReference<>();

        return httpClient.newWebSocketBuilder()
            .buildAsync(uri, new WebSocket.Listener() {
                private final StringBuilder buf = new StringBuilder();

                @Override
                public void onOpen(WebSocket webSocket) {
                    listener.onOpen(sessionRef.updateAndGet(s -> s != null ? s : new JdkSession(webSocket)));
                    webSocket.request(1);
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buf.append(data);
                    if (last) {
                        String msg = buf.toString();
                        buf.setLength(0);
                        listener.onText(msg);
                    }
                    webSocket.request(1);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    listener.onClosed(statusCode, reason);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    listener.onError(error);
                }
            })
            .handle((webSocket, error) -> {
                if (error != null) {
                    throw new FeedConnectionException(uri.getHost(), "WebSocket handshake failed", error);
                }
                return sessionRef.updateAndGet(s -> s != null ? s : new JdkSession(webSocket));
            });
    }

    private static final class JdkSession implements FeedSession {
        private final WebSocket webSocket;

        JdkSession(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public void send(String text) {
            webSocket.sendText(text, true).whenComplete((ws, error) -> {
                if (error != null) {
                    log.warn("[STREAM] Send failed: {}", error.getMessage());
                }
            });
        }

        @Override
        public void close() {
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").whenComplete((ws, error) -> {
                if (error != null) {
                    log.debug("[STREAM] Close handshake failed, aborting: {}", error.getMessage());
                    webSocket.abort();
                }
            });
        }
    }
}

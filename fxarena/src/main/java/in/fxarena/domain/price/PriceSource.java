package in.fxarena.domain.price;

/**
 * Where a served quote came from.
 */
public enum PriceSource {
    STREAM,   // Live streaming feed
    FETCHED,  // Synchronous upstream REST fetch
    CACHED,   // Process-local or shared tier
    FALLBACK  // Last-known quote, any age
}

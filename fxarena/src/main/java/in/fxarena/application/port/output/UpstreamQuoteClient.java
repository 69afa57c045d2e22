package in.fxarena.application.port.output;

import in.fxarena.domain.price.PriceQuote;

import java.util.Collection;
import java.util.Map;

/**
 * Synchronous request/response quote source used when the hot tiers miss.
 */
public interface UpstreamQuoteClient {

    /**
     * Fetch latest quotes. Symbols the upstream cannot price are omitted.
     * Implementations must bound their own latency.
     */
    Map<String, PriceQuote> fetchQuotes(Collection<String> symbols);
}

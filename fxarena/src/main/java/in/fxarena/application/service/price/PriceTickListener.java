package in.fxarena.application.service.price;

import in.fxarena.domain.price.PriceQuote;

/**
 * Receives every quote accepted into the streaming tier. Called on the
 * ingesting thread, so implementations must not block.
 */
@FunctionalInterface
public interface PriceTickListener {
    void onQuote(PriceQuote quote);
}

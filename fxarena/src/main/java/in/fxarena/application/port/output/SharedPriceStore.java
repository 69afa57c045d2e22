package in.fxarena.application.port.output;

import in.fxarena.domain.price.PriceQuote;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Distributed price tier shared between engine processes. Read only on a
 * cold start; written periodically and on every upstream fetch.
 */
public interface SharedPriceStore {

    Map<String, PriceQuote> read(Collection<String> symbols);

    void write(List<PriceQuote> quotes);
}

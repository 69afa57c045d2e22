package in.fxarena.domain.price;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ForexPairsTest {

    @Test
    void canonicalize_acceptsCommonSpellings() {
        assertEquals(Optional.of("EUR/USD"), ForexPairs.canonicalize("EUR/USD"));
        assertEquals(Optional.of("EUR/USD"), ForexPairs.canonicalize("eur-usd"));
        assertEquals(Optional.of("EUR/USD"), ForexPairs.canonicalize("EURUSD"));
        assertEquals(Optional.of("EUR/USD"), ForexPairs.canonicalize("C:EURUSD"));
        assertEquals(Optional.of("USD/JPY"), ForexPairs.canonicalize(" usd/jpy "));
    }

    @Test
    void canonicalize_rejectsNonPairs() {
        assertTrue(ForexPairs.canonicalize(null).isEmpty());
        assertTrue(ForexPairs.canonicalize("").isEmpty());
        assertTrue(ForexPairs.canonicalize("EURUS").isEmpty());
        assertTrue(ForexPairs.canonicalize("EUR/USD1").isEmpty());
        assertTrue(ForexPairs.canonicalize("123456").isEmpty());
    }

    @Test
    void catalog_knowsPipAndClass() {
        assertEquals(0, ForexPairs.JPY_PIP.compareTo(ForexPairs.pip("USD/JPY")));
        assertEquals(0, ForexPairs.STANDARD_PIP.compareTo(ForexPairs.pip("EUR/USD")));
        // Unknown JPY quote still gets the JPY pip
        assertEquals(0, ForexPairs.JPY_PIP.compareTo(ForexPairs.pip("SEK/JPY")));
        assertEquals(InstrumentClass.EXOTIC, ForexPairs.find("USD/TRY").orElseThrow().instrumentClass());
        assertEquals("GBP", ForexPairs.find("GBP/CHF").orElseThrow().baseCurrency());
        assertEquals("CHF", ForexPairs.find("GBP/CHF").orElseThrow().quoteCurrency());
        assertFalse(ForexPairs.isKnown("SEK/JPY"));
        assertEquals(0, ForexPairs.STANDARD_CONTRACT_SIZE.compareTo(ForexPairs.contractSize("SEK/JPY")));
    }
}

package com.perpconnector.broker;

import java.util.Optional;

/**
 * Bidirectional exchange-symbol to canonical-pair lookup. Fails closed: an unknown name
 * yields {@link Optional#empty()} rather than a guess.
 */
public interface SymbolMapper {

    Optional<String> toCanonicalPair(String exchangeSymbol);

    Optional<String> toExchangeSymbol(String tradingPair);
}

package com.perpconnector.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.perpconnector.config.ConnectorProperties;
import com.perpconnector.exception.NormalizationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Symbol map built from the exchange's instrument list and refreshed on the long poll cycle.
 *
 * <p>Exchange instruments are named {@code BASE-SUFFIX} (e.g. {@code ETH-PERP}) and map to the
 * canonical pair {@code BASE-<quoteAsset>} (e.g. {@code ETH-USDC}). Inactive instruments are
 * skipped. Both directions are replaced together on each refresh; lookups against a symbol
 * that is not in the current map return empty.
 */
@Component
public class InstrumentSymbolMapper implements SymbolMapper {

    private static final Logger log = LoggerFactory.getLogger(InstrumentSymbolMapper.class);

    private final ConnectorProperties connectorProperties;

    private volatile Mappings mappings = new Mappings(Map.of(), Map.of());

    public InstrumentSymbolMapper(ConnectorProperties connectorProperties) {
        this.connectorProperties = connectorProperties;
    }

    @Override
    public Optional<String> toCanonicalPair(String exchangeSymbol) {
        if (exchangeSymbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.pairsBySymbol().get(exchangeSymbol));
    }

    @Override
    public Optional<String> toExchangeSymbol(String tradingPair) {
        if (tradingPair == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.symbolsByPair().get(tradingPair));
    }

    /**
     * Rebuilds the map from a {@code get_all_instruments} response.
     *
     * @return number of active instruments mapped
     * @throws NormalizationException if the response is an error envelope or has no instrument list;
     *     the previous map stays in place
     */
    public int refresh(JsonNode response) {
        JsonNode error = response != null ? response.get("error") : null;
        if (error != null && !error.isNull()) {
            String exchangeMessage = error.path("message").asText(error.toString());
            throw new NormalizationException("Instrument refresh failed: " + exchangeMessage, exchangeMessage);
        }
        JsonNode instruments = response != null ? response.path("result").path("instruments") : null;
        if (instruments == null || !instruments.isArray()) {
            throw new NormalizationException("Instrument response has no instrument list", null);
        }

        String quoteAsset = connectorProperties.getQuoteAsset();
        Map<String, String> pairsBySymbol = new HashMap<>();
        Map<String, String> symbolsByPair = new HashMap<>();
        for (JsonNode instrument : instruments) {
            String symbol = instrument.path("instrument_name").asText(null);
            if (symbol == null || symbol.isEmpty() || !instrument.path("is_active").asBoolean(true)) {
                continue;
            }
            int dash = symbol.indexOf('-');
            String base = dash > 0 ? symbol.substring(0, dash) : symbol;
            String pair = base + "-" + quoteAsset;

            String existing = symbolsByPair.putIfAbsent(pair, symbol);
            if (existing != null) {
                log.warn("Instrument {} maps to {} already claimed by {}; keeping {}", symbol, pair, existing, existing);
                continue;
            }
            pairsBySymbol.put(symbol, pair);
        }

        mappings = new Mappings(Map.copyOf(pairsBySymbol), Map.copyOf(symbolsByPair));
        log.info("Symbol map refreshed: {} active instruments", pairsBySymbol.size());
        return pairsBySymbol.size();
    }

    public int size() {
        return mappings.pairsBySymbol().size();
    }

    private record Mappings(Map<String, String> pairsBySymbol, Map<String, String> symbolsByPair) {}
}

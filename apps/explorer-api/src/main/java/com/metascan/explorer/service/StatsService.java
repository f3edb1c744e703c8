package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.Stats;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.repository.StatsRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Currency statistics. Unknown currencies yield a document of the same shape with every attribute
 * set to {@value #NOT_AVAILABLE}.
 */
@Service
@Transactional(readOnly = true)
public class StatsService {

    static final String NOT_AVAILABLE = "N/A";
    static final String FIELD_NOT_FOUND = "Requested data not found";

    private static final String TYPE = "currency_stats";
    private static final List<String> CURRENCY_FIELDS = List.of(
            "currency_id", "token_name", "official_site", "currency_decimals", "current_circulation", "total_supply");
    private static final List<String> NETWORK_FIELDS = List.of(
            "currency_id", "currency_name", "currency_symbol", "official_site", "currency_decimals",
            "current_circulation", "total_supply");

    private final StatsRepository statsRepository;
    private final JsonApiSerializer serializer;
    private final String defaultCurrencyId;

    public StatsService(StatsRepository statsRepository,
                        JsonApiSerializer serializer,
                        ExplorerProperties properties) {
        this.statsRepository = statsRepository;
        this.serializer = serializer;
        this.defaultCurrencyId = properties.getCurrency().getDefaultId();
    }

    public String defaultCurrencyId() {
        return defaultCurrencyId;
    }

    public ObjectNode currencyStats(String currencyId) {
        Optional<Stats> stats = statsRepository.findById(currencyId);
        if (stats.isEmpty()) {
            return sentinel(currencyId, CURRENCY_FIELDS);
        }
        Stats s = stats.get();
        ObjectNode attributes = serializer.objectNode();
        attributes.put("currency_id", s.getId());
        attributes.put("token_name", s.getTokenName());
        attributes.put("official_site", s.getSite());
        attributes.put("currency_decimals", s.getDecimals());
        attributes.put("current_circulation", s.getCurrentCirculation());
        attributes.put("total_supply", s.getTotalSupply());
        return serializer.document(serializer.resource(TYPE, currencyId, attributes));
    }

    public ObjectNode networkStats(String currencyId) {
        Optional<Stats> stats = statsRepository.findById(currencyId);
        if (stats.isEmpty()) {
            return sentinel(currencyId, NETWORK_FIELDS);
        }
        Stats s = stats.get();
        ObjectNode attributes = serializer.objectNode();
        attributes.put("currency_id", s.getId());
        attributes.put("currency_name", s.getTokenName());
        attributes.put("currency_symbol", s.getSymbol());
        attributes.put("official_site", s.getSite());
        attributes.put("currency_decimals", s.getDecimals());
        attributes.put("current_circulation", s.getCurrentCirculation());
        attributes.put("total_supply", s.getTotalSupply());
        return serializer.document(serializer.resource(TYPE, currencyId, attributes));
    }

    /**
     * A single supply figure of the default currency as a bare JSON value.
     */
    public JsonNode defaultCurrencyField(String field) {
        Optional<Stats> stats = statsRepository.findById(defaultCurrencyId);
        if (stats.isEmpty()) {
            return TextNode.valueOf(FIELD_NOT_FOUND);
        }
        switch (field) {
            case "total_supply":
                return serializer.tree(stats.get().getTotalSupply());
            case "current_circulation":
                return serializer.tree(stats.get().getCurrentCirculation());
            default:
                return TextNode.valueOf(FIELD_NOT_FOUND);
        }
    }

    private ObjectNode sentinel(String currencyId, List<String> fields) {
        ObjectNode attributes = serializer.objectNode();
        fields.forEach(field -> attributes.put(field, NOT_AVAILABLE));
        return serializer.document(serializer.resource(TYPE, currencyId, attributes));
    }
}

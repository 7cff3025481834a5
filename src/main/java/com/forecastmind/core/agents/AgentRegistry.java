package com.forecastmind.core.agents;

import com.forecastmind.core.model.ForecastStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identifier-to-card catalog of available agents.
 * <p>
 * Registration is last-write-wins: re-registering an id replaces the card (keeping its
 * original position) and logs a warning. Lookups preserve registration order, which the
 * router relies on for stable tie-breaking.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentCard> cards = new LinkedHashMap<>();

    public AgentRegistry() {}

    public AgentRegistry(Collection<AgentCard> initial) {
        initial.forEach(this::register);
    }

    public synchronized void register(AgentCard card) {
        if (cards.containsKey(card.id())) {
            log.warn("Agent {} already registered, overwriting", card.id());
        }
        cards.put(card.id(), card);
        log.debug("Registered agent {} for stages {}", card.id(), card.capabilities().supportedStages());
    }

    public synchronized Optional<AgentCard> get(String agentId) {
        return Optional.ofNullable(cards.get(agentId));
    }

    public synchronized List<AgentCard> getAll() {
        return List.copyOf(cards.values());
    }

    public synchronized List<AgentCard> getByStage(ForecastStage stage) {
        return cards.values().stream().filter(card -> card.supports(stage)).toList();
    }

    public synchronized int size() {
        return cards.size();
    }

    /**
     * Splits the given ids into registered and unknown ones.
     */
    public synchronized Validation validate(Collection<String> agentIds) {
        var valid = new ArrayList<String>();
        var missing = new ArrayList<String>();
        for (String id : agentIds) {
            if (cards.containsKey(id)) {
                valid.add(id);
            } else {
                missing.add(id);
            }
        }
        return new Validation(List.copyOf(valid), List.copyOf(missing));
    }

    public record Validation(List<String> valid, List<String> missing) {
        public boolean isValid() {
            return missing.isEmpty();
        }
    }
}

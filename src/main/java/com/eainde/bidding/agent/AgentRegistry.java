package com.eainde.bidding.agent;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of agents taking part in a run.
 *
 * <p>Field ownership is a static partition: registration fails if an agent name repeats or
 * a field is already owned by another agent. Registration order is report order.</p>
 */
@Log4j2
public class AgentRegistry {

    private final Map<String, AgentSpec> agents = new LinkedHashMap<>();
    private final Map<String, String> fieldOwners = new HashMap<>();

    public static AgentRegistry of(AgentSpec... specs) {
        AgentRegistry registry = new AgentRegistry();
        for (AgentSpec spec : specs) {
            registry.register(spec);
        }
        return registry;
    }

    public synchronized AgentRegistry register(AgentSpec spec) {
        if (agents.containsKey(spec.agentName())) {
            throw new IllegalArgumentException("Agent '" + spec.agentName() + "' is already registered");
        }
        for (String field : spec.fieldNames()) {
            String owner = fieldOwners.get(field);
            if (owner != null) {
                throw new IllegalArgumentException("Field '" + field + "' of agent '" + spec.agentName()
                        + "' is already owned by agent '" + owner + "'");
            }
        }
        spec.fieldNames().forEach(field -> fieldOwners.put(field, spec.agentName()));
        agents.put(spec.agentName(), spec);
        log.debug("Registered agent {} with {} fields", spec.agentName(), spec.fields().size());
        return this;
    }

    public synchronized List<AgentSpec> specs() {
        return Collections.unmodifiableList(new ArrayList<>(agents.values()));
    }

    public synchronized Optional<AgentSpec> find(String agentName) {
        return Optional.ofNullable(agents.get(agentName));
    }

    public synchronized Optional<String> ownerOf(String fieldName) {
        return Optional.ofNullable(fieldOwners.get(fieldName));
    }

    public synchronized int size() {
        return agents.size();
    }
}

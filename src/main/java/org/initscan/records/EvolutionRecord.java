package org.initscan.records;

import java.util.List;

/**
 * An evolution of one species into another.
 *
 * @param fromSpecies The evolving species.
 * @param method The evolution method, e.g. {@code EVO_LEVEL}.
 * @param parameter The raw method parameter.
 * @param targetSpecies The resulting species.
 * @param conditions Additional conditions in source order.
 */
public record EvolutionRecord(String fromSpecies, String method, String parameter, String targetSpecies, List<String> conditions) {

    public EvolutionRecord {
        conditions = List.copyOf(conditions);
    }
}

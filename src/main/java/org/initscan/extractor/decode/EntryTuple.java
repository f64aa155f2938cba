package org.initscan.extractor.decode;

import java.util.List;

/**
 * One decoded entry of an evolution-style list.
 *
 * @param method The method constant, e.g. {@code EVO_LEVEL}.
 * @param parameter The raw parameter text, e.g. {@code 16} or {@code ITEM_FIRE_STONE}.
 * @param target The target constant, e.g. {@code SPECIES_IVYSAUR}.
 * @param conditions Additional conditions in source order; empty if there are none.
 */
public record EntryTuple(String method, String parameter, String target, List<String> conditions) {

    public EntryTuple {
        conditions = List.copyOf(conditions);
    }
}

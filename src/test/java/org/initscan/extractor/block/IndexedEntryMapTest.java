package org.initscan.extractor.block;

import org.initscan.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class IndexedEntryMapTest {

    @Test
    void overlayReplacesWholeEntries() {
        // Arrange
        IndexedEntryMap base = IndexedEntryMap.of(Map.of(
                "SPECIES_A", FieldMap.of(Map.of("baseHP", "10", "catchRate", "45"))));
        IndexedEntryMap patch = IndexedEntryMap.of(Map.of(
                "SPECIES_A", FieldMap.of(Map.of("baseHP", "20")),
                "SPECIES_B", FieldMap.of(Map.of("baseHP", "30"))));

        // Act
        IndexedEntryMap merged = base.overlay(patch);

        // Assert
        assertThat(merged.keys()).containsExactlyInAnyOrder("SPECIES_A", "SPECIES_B");
        FieldMap a = merged.get("SPECIES_A").orElseThrow();
        assertThat(a.get("baseHP")).contains("20");
        assertThat(a.contains("catchRate")).isFalse();
        assertThat(base.get("SPECIES_A").orElseThrow().get("catchRate")).contains("45");
    }

    @Test
    void overlayWithEmptyMapsKeepsTheOtherSide() {
        IndexedEntryMap map = IndexedEntryMap.of(Map.of("SPECIES_A", FieldMap.empty()));

        assertThat(map.overlay(IndexedEntryMap.empty())).isEqualTo(map);
        assertThat(IndexedEntryMap.empty().overlay(map)).isEqualTo(map);
    }

    @Test
    void viewsAreUnmodifiable() {
        FieldMap fields = FieldMap.of(Map.of("x", "1"));

        assertThatThrownBy(() -> fields.asMap().put("y", "2")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(fields.getOrDefault("y", "0")).isEqualTo("0");
        assertThat(fields.get("y")).isEmpty();
    }
}

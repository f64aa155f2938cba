package org.initscan.extractor.header;

/**
 * A move learned at a level.
 *
 * @param level The evaluated level.
 * @param move The move constant.
 */
public record LevelUpMove(int level, String move) {
}

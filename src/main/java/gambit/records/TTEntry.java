package gambit.records;

/**
 * One result-cache slot.
 *
 * @param depth depth the score was computed at
 * @param score the score, or the beta bound if the node was cut off
 */
public record TTEntry(int depth, int score) {}

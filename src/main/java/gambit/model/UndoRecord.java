package gambit.model;

/**
 * Everything needed to take back one make step: the move itself carries the captured piece and
 * the promotion flag, and the side to move is simply flipped back.
 */
public record UndoRecord(Move move) {}

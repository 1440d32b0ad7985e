package gambit.contracts;

import gambit.model.Position;

public interface Evaluator {
    int evaluate(Position pos);  // centipawns from side to move
}

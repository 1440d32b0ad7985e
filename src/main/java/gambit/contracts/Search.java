package gambit.contracts;

import gambit.model.Position;
import gambit.records.SearchResult;
import gambit.records.SearchSpec;

/**
 * Root move selection.
 */
public interface Search {

    /**
     * Picks a move for the side to move. {@code pos} is restored before returning; the chosen
     * move is <em>not</em> applied.
     *
     * @throws IllegalStateException if the side to move has no legal move
     */
    SearchResult search(Position pos, SearchSpec spec);
}

package gambit.impl;

import gambit.contracts.TranspositionTable;
import gambit.model.Piece.Color;
import gambit.model.Position;
import gambit.records.TTEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Unbounded hash map from exact key to {@link TTEntry}.
 *
 * <p>The key is the 64-character board image, one side character and the depth, so two
 * different positions (or the same position at two depths) never share a slot.
 */
public final class TranspositionTableImpl implements TranspositionTable {

    private static final Logger logger = LoggerFactory.getLogger(TranspositionTableImpl.class);

    private final Map<String, TTEntry> table = new HashMap<>();

    @Override
    public String key(Position pos, int depth) {
        return pos.boardKey() + (pos.sideToMove() == Color.WHITE ? 'w' : 'b') + depth;
    }

    @Override
    public TTEntry probe(String key) {
        return table.get(key);
    }

    @Override
    public void store(String key, int depth, int score) {
        table.put(key, new TTEntry(depth, score));
    }

    @Override
    public void clear() {
        logger.debug("Clearing result cache ({} entries)", table.size());
        table.clear();
    }

    @Override
    public int size() {
        return table.size();
    }
}

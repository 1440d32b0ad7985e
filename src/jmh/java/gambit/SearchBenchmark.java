package gambit;

import gambit.contracts.*;
import gambit.impl.*;
import gambit.model.Position;
import gambit.records.SearchResult;
import gambit.records.SearchSpec;
import org.openjdk.jmh.annotations.*;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Cold-cache root search from a middlegame position; the result cache is rebuilt per call.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
public class SearchBenchmark {

  private static final String FEN = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w - - 0 1";

  @Param({"2", "3", "4"})
  public int depth;

  private final PositionFactory pf  = new PositionFactoryImpl();
  private final MoveGenerator   mg  = new MoveGeneratorImpl(pf);
  private final Evaluator       ev  = new EvaluatorImpl();
  private final MoveOrderer     ord = new MoveOrdererImpl();

  private Position root;
  private SearchSpec spec;

  @Setup(Level.Trial)
  public void init() {
    root = pf.fromFen(FEN);
    spec = new SearchSpec.Builder().depth(depth).build();
  }

  @Benchmark
  public SearchResult search() {
    Searcher ab = new AlphaBetaSearcherImpl(pf, mg, ev, ord, new TranspositionTableImpl());
    return new SearchImpl(pf, mg, ev, ord, ab, new Random(1)).search(root, spec);
  }
}

package gambit;

import gambit.contracts.MoveGenerator;
import gambit.contracts.PositionFactory;
import gambit.impl.MoveGeneratorImpl;
import gambit.impl.PositionFactoryImpl;
import gambit.model.Move;
import gambit.model.Position;
import gambit.model.UndoRecord;
import org.openjdk.jmh.annotations.*;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Throughput benchmark that performs the same perft as {@code MoveGeneratorPerftTest}, but
 * under the JMH harness.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
public class PerftBenchmark {

  /* ── engine wiring ─────────────────────────────────────────── */
  private static final PositionFactory FACT = new PositionFactoryImpl();
  private static final MoveGenerator  GEN  = new MoveGeneratorImpl(FACT);

  private record Case(Position root, int depth) {}
  private List<Case> cases;

  /* simple node counter so JMH can report throughput ----------- */
  @AuxCounters(AuxCounters.Type.EVENTS)
  @State(Scope.Thread)
  public static class Metrics { public long nodes; }

  /* ── load /perft/gambit.txt at trial start ────────────────── */
  @Setup(Level.Trial)
  public void init() throws Exception {
    cases = new ArrayList<>();

    try (var is = getClass().getResourceAsStream("/perft/gambit.txt");
         var br = new BufferedReader(new InputStreamReader(Objects.requireNonNull(is), StandardCharsets.UTF_8))) {

      br.lines()
              .map(String::trim)
              .filter(l -> !(l.isEmpty() || l.startsWith("#")))
              .forEach(l -> {
                String[] p = l.split(";");
                int depth = Integer.parseInt(p[1].replaceAll("[^0-9]", ""));
                cases.add(new Case(FACT.fromFen(p[0].trim()), depth));
              });
    }
    if (cases.isEmpty())
      throw new IllegalStateException("no perft vectors found");
  }

  @Benchmark
  public void perftNodes(Metrics m) {
    long total = 0;
    for (Case c : cases)
      total += perft(c.root.copy(), c.depth);
    m.nodes += total;
  }

  private static long perft(Position pos, int depth) {
    if (depth == 0) return 1;

    long nodes = 0;
    for (Move mv : GEN.generateLegalMoves(pos)) {
      UndoRecord u = FACT.makeMove(pos, mv);
      nodes += perft(pos, depth - 1);
      FACT.undoMove(pos, u);
    }
    return nodes;
  }
}

package io.hll.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Measures the estimation error of a sketch on random data sets and writes min, median and max errors
 * per cardinality as TSV.
 *
 * <pre>
 * Arguments: &lt;estimator&gt; &lt;from&gt; &lt;to&gt; &lt;runs&gt; [&lt;outFile&gt; [&lt;seed&gt;]]
 * </pre>
 *
 * <p>Run i draws its values from seed + i, so passing the seed logged by a previous report reproduces it.
 */
public class AccuracyReport
{
  private static final Logger log = LoggerFactory.getLogger(AccuracyReport.class);

  // above this we can't generate data using a set due to limited memory
  private static final int MAX_SET_CARDINALITY = 100_000;

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality.
   *
   * @return errors for each experiment, errors[i][j] = errors of cardinality i of the j-th run.
   */
  @VisibleForTesting
  static double[][] testDifferentCardinalities(
      Supplier<CardinalityEstimator<?>> estimatorSupplier,
      final int fromCard,
      final int toCard,
      final int numRuns,
      final long seed
  )
  {
    checkCardinalities(fromCard, toCard);
    final int numCard = toCard / fromCard;

    double[][] errors = new double[numCard][];
    for (int i = 0; i < numCard; i++) {
      errors[i] = new double[numRuns];
    }

    for (int run = 0; run < numRuns; run++) {
      // reset estimator at the beginning of each run
      CardinalityEstimator.Builder<?> builder = estimatorSupplier.get().toBuilder();
      final long runSeed = seed + run;
      ValueSource source = toCard <= MAX_SET_CARDINALITY ? new DistinctLongs(runSeed) : new RandomIds(runSeed);
      final long start = System.currentTimeMillis();

      // estimate cardinality of 1*startCard, 2*startCard, 3*startCard, .., maxCard
      for (int card = 1; card <= toCard; card++) {
        source.addNext(builder);

        if (card % fromCard == 0) {
          double est = builder.cardinality();
          double error = 100.0 * (est - card) / card;
          errors[card / fromCard - 1][run] = Math.abs(error);
        }
      }
      log.info("Finish run #{} in {} ms", run, System.currentTimeMillis() - start);
    }

    return errors;
  }

  @VisibleForTesting
  static List<OneResult> summarize(int fromCard, double[][] errors)
  {
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }
    return results;
  }

  private static void checkCardinalities(int fromCard, int toCard)
  {
    if (fromCard <= 0 || toCard <= fromCard || toCard % fromCard != 0) {
      throw new IllegalArgumentException("illegal from \"" + fromCard + "\" and to \"" + toCard + "\"");
    }
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 6) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [<outFile> [<seed>]]");
      System.exit(1);
    }

    Supplier<CardinalityEstimator<?>> estimatorSupplier = CardinalityEstimators.lazyGet(args[0]);
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);
    checkCardinalities(fromCard, toCard);

    Path outFile;
    if (args.length >= 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(String.format("%s_%d_%d_%d.tsv", args[0], fromCard, toCard, numRuns));
    }
    final long seed = args.length == 6 ? Long.parseLong(args[5]) : new Random().nextLong();
    log.info("Using seed {}", seed);

    final double[][] errors = testDifferentCardinalities(estimatorSupplier, fromCard, toCard, numRuns, seed);
    List<OneResult> results = summarize(fromCard, errors);

    log.info("Writing results to {}", outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(String.format(
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
    }
  }

  private interface ValueSource
  {
    void addNext(CardinalityEstimator.Builder<?> builder);
  }

  private static final class DistinctLongs implements ValueSource
  {
    private final Random random;
    private final Set<Long> set = new HashSet<>();

    DistinctLongs(long seed)
    {
      this.random = new Random(seed);
    }

    @Override
    public void addNext(CardinalityEstimator.Builder<?> builder)
    {
      long value;
      do {
        value = random.nextLong();
      } while (!set.add(value));
      builder.add(value);
    }
  }

  private static final class RandomIds implements ValueSource
  {
    private final FastRandomIdGenerator generator;

    RandomIds(long seed)
    {
      this.generator = new FastRandomIdGenerator(seed);
    }

    @Override
    public void addNext(CardinalityEstimator.Builder<?> builder)
    {
      builder.add(generator.generate());
    }
  }

  static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      Arrays.sort(errors);
      return new OneResult(
          cardinality,
          errors[0],
          errors[errors.length / 2],
          errors[errors.length - 1]
      );
    }
  }
}

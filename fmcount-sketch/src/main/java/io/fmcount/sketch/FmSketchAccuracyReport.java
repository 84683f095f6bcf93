package io.fmcount.sketch;

import com.google.common.base.Preconditions;
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
import java.util.List;

/**
 * Measures the relative error of {@link FmSketchAggregator} on synthetic data.
 *
 * <p>For every run the value stream is dealt round-robin over a number of partitions, each with its own
 * aggregator, and the partitions are merged before reading the estimate, the way a parallel
 * aggregation would.
 */
public class FmSketchAccuracyReport
{
  private static final Logger log = LoggerFactory.getLogger(FmSketchAccuracyReport.class);

  private final Supplier<FmSketchAggregator> aggregatorSupplier;

  public FmSketchAccuracyReport(Supplier<FmSketchAggregator> aggregatorSupplier)
  {
    this.aggregatorSupplier = Preconditions.checkNotNull(aggregatorSupplier, "aggregatorSupplier");
  }

  /**
   * Run estimation on data sets of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   *
   * @return errors in percent, errors[i][j] = error at cardinality (i + 1) * fromCard in the j-th run
   */
  public double[][] measure(final int fromCard, final int toCard, final int numRuns, final int numPartitions)
  {
    Preconditions.checkArgument(
        fromCard > 0 && toCard >= fromCard && toCard % fromCard == 0,
        "illegal from \"%s\" and to \"%s\"",
        fromCard,
        toCard
    );
    Preconditions.checkArgument(numRuns > 0, "runs must be positive, got %s", numRuns);
    Preconditions.checkArgument(numPartitions > 0, "partitions must be positive, got %s", numPartitions);

    final int numCard = toCard / fromCard;
    double[][] errors = new double[numCard][numRuns];

    for (int run = 0; run < numRuns; run++) {
      FastRandomIdGenerator generator = new FastRandomIdGenerator(run);
      List<FmSketchAggregator> partitions = new ArrayList<>(numPartitions);
      for (int p = 0; p < numPartitions; p++) {
        partitions.add(aggregatorSupplier.get());
      }
      final long start = System.currentTimeMillis();

      for (int card = 1; card <= toCard; card++) {
        partitions.get(card % numPartitions).add(generator.generate());

        if (card % fromCard == 0) {
          double est = estimate(partitions);
          errors[card / fromCard - 1][run] = Math.abs(100.0 * (est - card) / card);
        }
      }
      log.info("Finished run #{} in {} ms", run, System.currentTimeMillis() - start);
    }
    return errors;
  }

  // merges copies so the partitions can keep accumulating
  private double estimate(List<FmSketchAggregator> partitions)
  {
    FmSketchAggregator merged = aggregatorSupplier.get();
    for (FmSketchAggregator partition : partitions) {
      merged.merge(FmSketchAggregator.fromBytes(partition.toBytes()));
    }
    return merged.cardinality();
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 5) {
      System.err.println("Arguments: <from> <to> <runs> <partitions> [<outFile>]");
      System.exit(1);
    }

    final int fromCard = Integer.parseInt(args[0]);
    final int toCard = Integer.parseInt(args[1]);
    final int numRuns = Integer.parseInt(args[2]);
    final int numPartitions = Integer.parseInt(args[3]);

    Path outFile;
    if (args.length == 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(String.format("fmsketch_%d_%d_%d_%d.tsv", fromCard, toCard, numRuns, numPartitions));
    }

    FmSketchAccuracyReport report = new FmSketchAccuracyReport(FmSketchAggregator::new);
    final double[][] errors = report.measure(fromCard, toCard, numRuns, numPartitions);

    log.info("Writing results to {}", outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (int i = 0; i < errors.length; i++) {
        OneResult result = OneResult.from((long) (i + 1) * fromCard, errors[i]);
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
      double[] sorted = errors.clone();
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}

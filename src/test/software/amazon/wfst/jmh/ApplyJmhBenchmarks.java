package software.amazon.wfst.jmh;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Timeout;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Iterator;

import static java.util.concurrent.TimeUnit.SECONDS;

@BenchmarkMode(Mode.Throughput)
@Fork(value = 2, jvmArgsAppend = {
        "-Xmx2g", "-Xms2g", "-XX:+AlwaysPreTouch", "-XX:+UseSerialGC",
})
@Timeout(time = 90, timeUnit = SECONDS)
@OperationsPerInvocation(LexiconState.DATASET_SIZE)
public class ApplyJmhBenchmarks {

    @Benchmark
    @Warmup(iterations = 4, batchSize = 1, time = 10, timeUnit = SECONDS)
    @Measurement(iterations = 5, batchSize = 1, time = 10, timeUnit = SECONDS)
    public void group01Generate(LexiconState lexicon, Blackhole blackhole) {
        for (String word : lexicon.surfaceForms) {
            drain(lexicon.fst.generate(word), blackhole);
        }
    }

    @Benchmark
    @Warmup(iterations = 4, batchSize = 1, time = 10, timeUnit = SECONDS)
    @Measurement(iterations = 5, batchSize = 1, time = 10, timeUnit = SECONDS)
    public void group02Analyze(LexiconState lexicon, Blackhole blackhole) {
        for (String word : lexicon.analyses) {
            drain(lexicon.fst.analyze(word), blackhole);
        }
    }

    @Benchmark
    @Warmup(iterations = 4, batchSize = 1, time = 10, timeUnit = SECONDS)
    @Measurement(iterations = 5, batchSize = 1, time = 10, timeUnit = SECONDS)
    public void group03FirstResultOnly(LexiconState lexicon, Blackhole blackhole) {
        for (String word : lexicon.surfaceForms) {
            Iterator<String> results = lexicon.fst.generate(word);
            if (results.hasNext()) {
                blackhole.consume(results.next());
            }
        }
    }

    private static void drain(Iterator<String> results, Blackhole blackhole) {
        while (results.hasNext()) {
            blackhole.consume(results.next());
        }
    }
}

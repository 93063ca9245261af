package works.varia;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.openjdk.jmh.annotations.Mode.Throughput;

/**
 * Building, validating and reading a mid-sized document:
 * an array of records, each with a handful of scalar fields and a nested tag list.
 */
@BenchmarkMode(Throughput)
@State(Scope.Thread)
@Fork(3)
@Warmup(iterations = 8, time = 1)
@Measurement(iterations = 5, time = 1, timeUnit = SECONDS)
public class VariantBenchmark {
	private static final int RECORDS = 200;

	private EncodedVariant encoded;
	private VariantValidator validator;

	@Setup(Level.Iteration)
	public void setup() {
		encoded = build(true);
		validator = new VariantValidator();
	}

	@Benchmark
	public EncodedVariant buildSorted() {
		return build(true);
	}

	@Benchmark
	public EncodedVariant buildInsertionOrder() {
		return build(false);
	}

	@Benchmark
	public Variant validate() {
		return validator.validate(encoded.metadata(), encoded.value());
	}

	@Benchmark
	public long lookupByName() {
		long sum = 0;
		for (Variant record: encoded.toVariant().getArray()) {
			sum += record.getObject().get("id").orElseThrow().getLong();
		}
		return sum;
	}

	private static EncodedVariant build(boolean sorted) {
		VariantBuilder builder = new VariantBuilder(VariantBuilder.Settings.DEFAULT.withSortedDictionary(sorted));
		try (ArrayBuilder records = builder.startArray()) {
			for (int i = 0; i < RECORDS; i++) {
				try (ObjectBuilder record = records.startObject()) {
					record.key("name").appendString("record number " + i);
					record.key("id").appendLong(i);
					record.key("score").appendDouble(i * 0.5);
					record.key("active").appendBoolean(i % 2 == 0);
					try (ArrayBuilder tags = record.key("tags").startArray()) {
						tags.appendString("alpha");
						tags.appendString("beta");
						tags.end();
					}
					record.end();
				}
			}
			records.end();
		}
		return builder.finish();
	}
}

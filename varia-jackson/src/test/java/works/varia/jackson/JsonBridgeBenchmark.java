package works.varia.jackson;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import works.varia.EncodedVariant;

import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static org.openjdk.jmh.annotations.Mode.AverageTime;

@BenchmarkMode(AverageTime)
@Fork(1)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 1)
@OutputTimeUnit(MICROSECONDS)
public class JsonBridgeBenchmark {

	@State(Scope.Benchmark)
	public static class BenchmarkState {
		private JsonBridge bridge;
		private String json;
		private EncodedVariant encoded;

		@Setup(Level.Trial)
		public void setup() {
			bridge = new JsonBridge();
			StringBuilder sb = new StringBuilder("[");
			for (int i = 0; i < 200; i++) {
				if (i > 0) {
					sb.append(',');
				}
				sb.append("{\"name\":\"record number ").append(i)
					.append("\",\"id\":").append(i)
					.append(",\"score\":").append(i * 0.5)
					.append(",\"active\":").append(i % 2 == 0)
					.append(",\"tags\":[\"alpha\",\"beta\"]}");
			}
			json = sb.append(']').toString();
			encoded = bridge.fromJson(json);
		}
	}

	@Benchmark
	public EncodedVariant fromJson(BenchmarkState state) {
		return state.bridge.fromJson(state.json);
	}

	@Benchmark
	public String toJson(BenchmarkState state) {
		return state.bridge.toJson(state.encoded);
	}
}

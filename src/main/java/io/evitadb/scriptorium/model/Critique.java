package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Document-level quality verdict of the critique stage. The halt decision is the single
 * {@code hasCriticalError} flag; per-chunk findings are informational and feed the revision prompts.
 *
 * @param hasCriticalError whether the job must halt before assembly
 * @param issues           document-level findings
 * @param chunkIssues      findings attributed to a chunk index
 * @param failureReason    set when the critique itself could not be produced
 */
public record Critique(
	boolean hasCriticalError,
	@Nonnull List<String> issues,
	@Nonnull Map<Integer, List<String>> chunkIssues,
	@Nullable String failureReason
) {

	public Critique {
		issues = issues == null ? List.of() : List.copyOf(issues);
		final Map<Integer, List<String>> copy = new TreeMap<>();
		if (chunkIssues != null) {
			chunkIssues.forEach((index, findings) -> copy.put(index, List.copyOf(findings)));
		}
		chunkIssues = Collections.unmodifiableMap(copy);
	}

	/**
	 * Verdict of a critique stage that could not complete. Treated as critical so that quality
	 * assurance is never skipped silently.
	 *
	 * @param reason human-readable cause
	 * @return critical critique
	 */
	@Nonnull
	public static Critique failed(@Nonnull String reason) {
		return new Critique(true, List.of(), Map.of(), reason);
	}

	/**
	 * Returns findings relevant to one chunk: its own findings followed by the document-level ones.
	 */
	@Nonnull
	public List<String> findingsFor(int chunkIndex) {
		final List<String> findings = new ArrayList<>(this.chunkIssues.getOrDefault(chunkIndex, List.of()));
		findings.addAll(this.issues);
		return findings;
	}

	/**
	 * Builds the human-readable cause stored in the job's error info when this critique halts a job.
	 */
	@Nonnull
	public String describeHalt() {
		if (this.failureReason != null) {
			return "Critique stage failed: " + this.failureReason;
		}
		final List<String> all = new ArrayList<>();
		this.chunkIssues.forEach((index, findings) -> findings.forEach(f -> all.add("chunk " + index + ": " + f)));
		all.addAll(this.issues);
		return "Critique reported critical errors: " + (all.isEmpty() ? "no details provided" : String.join("; ", all));
	}
}

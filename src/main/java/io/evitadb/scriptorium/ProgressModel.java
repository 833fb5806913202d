package io.evitadb.scriptorium;

import io.evitadb.scriptorium.model.PipelineStep;
import io.evitadb.scriptorium.model.TranslationMode;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Maps pipeline positions to progress percentages. Each step contributes its weight; weights are
 * normalized over the steps the mode actually runs, so quick mode also ends at 100.
 */
final class ProgressModel {

	private static final List<PipelineStep> QUICK_PATH = List.of(
		PipelineStep.CHUNKING, PipelineStep.TRANSLATING, PipelineStep.ASSEMBLING
	);
	private static final List<PipelineStep> DEEP_PATH = List.of(
		PipelineStep.CHUNKING, PipelineStep.TERMINOLOGY_UNIFICATION, PipelineStep.TRANSLATING,
		PipelineStep.CRITIQUING, PipelineStep.REVISING, PipelineStep.ASSEMBLING
	);

	private ProgressModel() {
		// Utility class - prevent instantiation
	}

	/**
	 * Steps executed by the mode, in order.
	 */
	@Nonnull
	static List<PipelineStep> path(@Nonnull TranslationMode mode) {
		return mode == TranslationMode.QUICK ? QUICK_PATH : DEEP_PATH;
	}

	/**
	 * Progress when the given fraction of a step is done.
	 *
	 * @param mode     pipeline variant
	 * @param step     current step
	 * @param fraction part of the step already done, 0 to 1
	 * @return progress percentage, 0 to 100
	 */
	static int progress(@Nonnull TranslationMode mode, @Nonnull PipelineStep step, double fraction) {
		if (step == PipelineStep.COMPLETED) {
			return 100;
		}
		final List<PipelineStep> path = path(mode);
		final int index = path.indexOf(step);
		if (index < 0) {
			return 0;
		}
		int total = 0;
		int before = 0;
		for (int i = 0; i < path.size(); i++) {
			total += path.get(i).weight();
			if (i < index) {
				before += path.get(i).weight();
			}
		}
		final double clamped = Math.max(0.0, Math.min(1.0, fraction));
		return (int) Math.floor((before + step.weight() * clamped) * 100.0 / total);
	}
}

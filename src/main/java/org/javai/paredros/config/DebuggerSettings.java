package org.javai.paredros.config;

/**
 * Tuning knobs for graph construction, inference, expansion and event collection.
 *
 * @param lookaheadDepth number of upcoming tokens shown per step
 * @param maxExpansionSteps upper bound on network steps walked for one alternative
 * @param inferenceBudget upper bound on configurations visited when inferring one choice
 * @param maxCallDepth deepest rule nesting followed by inference and expansion
 * @param resolveLl1Decisions whether expansion continues through decisions one token can settle
 * @param mergeDuplicateDecisions whether repeated reports of one decision fold into one step
 * @param reportChosenAlternatives whether the engine adapter reports predicted alternatives
 */
public record DebuggerSettings(
		int lookaheadDepth,
		int maxExpansionSteps,
		int inferenceBudget,
		int maxCallDepth,
		boolean resolveLl1Decisions,
		boolean mergeDuplicateDecisions,
		boolean reportChosenAlternatives
) {

	public static final int DEFAULT_LOOKAHEAD_DEPTH = 3;
	public static final int DEFAULT_MAX_EXPANSION_STEPS = 1000;
	public static final int DEFAULT_INFERENCE_BUDGET = 100_000;
	public static final int DEFAULT_MAX_CALL_DEPTH = 256;

	public DebuggerSettings {
		requirePositive("navigation.lookahead_depth", lookaheadDepth);
		requirePositive("expansion.max_steps", maxExpansionSteps);
		requirePositive("inference.budget", inferenceBudget);
		requirePositive("inference.max_call_depth", maxCallDepth);
	}

	public static DebuggerSettings defaults() {
		return new DebuggerSettings(DEFAULT_LOOKAHEAD_DEPTH, DEFAULT_MAX_EXPANSION_STEPS, DEFAULT_INFERENCE_BUDGET,
				DEFAULT_MAX_CALL_DEPTH, true, true, true);
	}

	public DebuggerSettings withReportChosenAlternatives(boolean report) {
		return new DebuggerSettings(lookaheadDepth, maxExpansionSteps, inferenceBudget, maxCallDepth,
				resolveLl1Decisions, mergeDuplicateDecisions, report);
	}

	public DebuggerSettings withResolveLl1Decisions(boolean resolve) {
		return new DebuggerSettings(lookaheadDepth, maxExpansionSteps, inferenceBudget, maxCallDepth, resolve,
				mergeDuplicateDecisions, reportChosenAlternatives);
	}

	public DebuggerSettings withMaxExpansionSteps(int steps) {
		return new DebuggerSettings(lookaheadDepth, steps, inferenceBudget, maxCallDepth, resolveLl1Decisions,
				mergeDuplicateDecisions, reportChosenAlternatives);
	}

	private static void requirePositive(String key, int value) {
		if (value <= 0) {
			throw new SettingsException("'" + key + "' must be positive, got " + value);
		}
	}
}

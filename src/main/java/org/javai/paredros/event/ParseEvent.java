package org.javai.paredros.event;

import java.util.List;
import java.util.Objects;
import org.javai.paredros.network.TransitionNetwork;

/**
 * One step reported by a parsing engine.
 *
 * @param kind what happened
 * @param ruleId rule active at the step (the entered or exited rule for rule events)
 * @param stateId network state at the step
 * @param tokenIndex index of the current token; for consumptions the consumed token
 * @param lookahead upcoming tokens the engine examined, possibly empty
 * @param availableAlternatives target states of a decision's alternatives in order; empty means
 * the network's transition order applies
 * @param chosenAlternative 1-based alternative taken at a decision, or {@code null} when the
 * engine does not report it
 * @param returnStateId state the caller resumes at after an entered rule, or
 * {@link TransitionNetwork#NO_STATE}
 */
public record ParseEvent(
		ParseEventKind kind,
		int ruleId,
		int stateId,
		int tokenIndex,
		List<TokenInfo> lookahead,
		List<Integer> availableAlternatives,
		Integer chosenAlternative,
		int returnStateId
) {

	public ParseEvent {
		Objects.requireNonNull(kind, "kind");
		lookahead = lookahead != null ? List.copyOf(lookahead) : List.of();
		availableAlternatives = availableAlternatives != null ? List.copyOf(availableAlternatives) : List.of();
	}

	public static ParseEvent ruleEnter(int ruleId, int startStateId, int tokenIndex, int returnStateId) {
		return new ParseEvent(ParseEventKind.RULE_ENTER, ruleId, startStateId, tokenIndex, List.of(), List.of(), null,
				returnStateId);
	}

	public static ParseEvent ruleEnter(int ruleId, int startStateId, int tokenIndex) {
		return ruleEnter(ruleId, startStateId, tokenIndex, TransitionNetwork.NO_STATE);
	}

	public static ParseEvent ruleExit(int ruleId, int stopStateId, int tokenIndex) {
		return new ParseEvent(ParseEventKind.RULE_EXIT, ruleId, stopStateId, tokenIndex, List.of(), List.of(), null,
				TransitionNetwork.NO_STATE);
	}

	public static ParseEvent tokenConsume(int ruleId, int stateId, int tokenIndex) {
		return new ParseEvent(ParseEventKind.TOKEN_CONSUME, ruleId, stateId, tokenIndex, List.of(), List.of(), null,
				TransitionNetwork.NO_STATE);
	}

	public static ParseEvent decision(int ruleId, int stateId, int tokenIndex, Integer chosenAlternative) {
		return new ParseEvent(ParseEventKind.DECISION_ENTER, ruleId, stateId, tokenIndex, List.of(), List.of(),
				chosenAlternative, TransitionNetwork.NO_STATE);
	}

	public ParseEvent withLookahead(List<TokenInfo> tokens) {
		return new ParseEvent(kind, ruleId, stateId, tokenIndex, tokens, availableAlternatives, chosenAlternative,
				returnStateId);
	}

	public ParseEvent withAvailableAlternatives(List<Integer> targetStates) {
		return new ParseEvent(kind, ruleId, stateId, tokenIndex, lookahead, targetStates, chosenAlternative,
				returnStateId);
	}

	public boolean hasChosenAlternative() {
		return chosenAlternative != null;
	}

	public boolean isObservable() {
		return kind != ParseEventKind.DECISION_ENTER;
	}
}

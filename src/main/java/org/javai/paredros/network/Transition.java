package org.javai.paredros.network;

import java.util.Set;

/**
 * A directed edge of the transition network.
 * <p>
 * Token transitions carry the token types they match. Rule-call transitions point at the called
 * rule's start state and carry the follow state parsing returns to.
 *
 * @param from source state
 * @param to target state (the rule start state for rule calls)
 * @param kind what following the edge does
 * @param label human readable description
 * @param tokenTypes matched token types, empty unless {@link TransitionKind#TOKEN}
 * @param calledRule called rule id, or -1
 * @param followState return state of a rule call, or {@link TransitionNetwork#NO_STATE}
 */
public record Transition(
		int from,
		int to,
		TransitionKind kind,
		String label,
		Set<Integer> tokenTypes,
		int calledRule,
		int followState
) {

	public Transition {
		tokenTypes = tokenTypes != null ? Set.copyOf(tokenTypes) : Set.of();
	}

	public static Transition epsilon(int from, int to) {
		return new Transition(from, to, TransitionKind.EPSILON, null, Set.of(), -1, TransitionNetwork.NO_STATE);
	}

	public static Transition precedence(int from, int to, String label) {
		return new Transition(from, to, TransitionKind.PRECEDENCE, label, Set.of(), -1, TransitionNetwork.NO_STATE);
	}

	public static Transition token(int from, int to, Set<Integer> tokenTypes) {
		if (tokenTypes == null || tokenTypes.isEmpty()) {
			throw new IllegalArgumentException("Token transition " + from + " -> " + to + " matches no token type");
		}
		return new Transition(from, to, TransitionKind.TOKEN, null, tokenTypes, -1, TransitionNetwork.NO_STATE);
	}

	public static Transition ruleCall(int from, int ruleStartState, int calledRule, int followState) {
		return new Transition(from, ruleStartState, TransitionKind.RULE_CALL, null, Set.of(), calledRule, followState);
	}

	public boolean matches(int tokenType) {
		return kind == TransitionKind.TOKEN && tokenTypes.contains(tokenType);
	}

	Transition withLabel(String newLabel) {
		return new Transition(from, to, kind, newLabel, tokenTypes, calledRule, followState);
	}
}

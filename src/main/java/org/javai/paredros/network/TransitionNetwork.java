package org.javai.paredros.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable model of a grammar's compiled state machine: states, ordered transitions, rule
 * boundaries and token names.
 * <p>
 * The network is read-only once built. Transition order is significant: the outgoing transitions
 * of a branching state are its alternatives, numbered from 1 in that order.
 */
public final class TransitionNetwork {

	public static final int NO_STATE = -1;
	public static final int EOF = -1;

	private static final int MAX_LABEL_SYMBOLS = 6;

	private final Map<Integer, NetworkState> states;
	private final Map<Integer, List<Transition>> transitions;
	private final Map<Integer, RuleInfo> rules;
	private final Map<Integer, String> tokenNames;

	private TransitionNetwork(Builder builder) {
		this.states = Collections.unmodifiableMap(new TreeMap<>(builder.states));
		Map<Integer, List<Transition>> byState = new TreeMap<>();
		for (Map.Entry<Integer, List<Transition>> entry : builder.transitions.entrySet()) {
			byState.put(entry.getKey(), List.copyOf(entry.getValue()));
		}
		this.transitions = Collections.unmodifiableMap(byState);
		this.rules = Collections.unmodifiableMap(new TreeMap<>(builder.rules));
		this.tokenNames = Collections.unmodifiableMap(new TreeMap<>(builder.tokenNames));
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<NetworkState> state(int id) {
		return Optional.ofNullable(states.get(id));
	}

	public int stateCount() {
		return states.size();
	}

	public List<Transition> transitionsFrom(int stateId) {
		return transitions.getOrDefault(stateId, List.of());
	}

	/**
	 * Whether parsing has to choose between several outgoing paths at the given state.
	 */
	public boolean isBranching(int stateId) {
		NetworkState state = states.get(stateId);
		return state != null && !state.isRuleStop() && transitionsFrom(stateId).size() > 1;
	}

	public boolean hasRule(int ruleId) {
		return rules.containsKey(ruleId);
	}

	public int ruleCount() {
		return rules.size();
	}

	public String ruleName(int ruleId) {
		RuleInfo rule = rules.get(ruleId);
		return rule != null ? rule.name() : "rule#" + ruleId;
	}

	public OptionalInt ruleId(String name) {
		return rules.values().stream()
				.filter(rule -> rule.name().equals(name))
				.mapToInt(RuleInfo::id)
				.findFirst();
	}

	public int ruleStartState(int ruleId) {
		return requireRule(ruleId).startState();
	}

	public int ruleStopState(int ruleId) {
		return requireRule(ruleId).stopState();
	}

	public String tokenName(int tokenType) {
		if (tokenType == EOF) {
			return "EOF";
		}
		return tokenNames.getOrDefault(tokenType, "#" + tokenType);
	}

	/**
	 * Finds the transition leaving {@code fromState} that leads to {@code targetState}. When the
	 * network holds no such edge an epsilon edge is assumed.
	 */
	public Transition entryTransition(int fromState, int targetState) {
		for (Transition transition : transitionsFrom(fromState)) {
			if (transition.to() == targetState) {
				return transition;
			}
		}
		return Transition.epsilon(fromState, targetState);
	}

	/**
	 * Describes the path that starts with the given transition as the sequence of tokens and rule
	 * references it deterministically runs through, up to the next branching point.
	 */
	public String describePath(Transition entry) {
		List<String> symbols = new ArrayList<>();
		boolean truncated = false;
		Transition current = entry;
		Set<Integer> seen = new java.util.HashSet<>();
		while (current != null) {
			if (current.kind() == TransitionKind.TOKEN || current.kind() == TransitionKind.RULE_CALL) {
				symbols.add(current.label());
			}
			int next = current.kind() == TransitionKind.RULE_CALL ? current.followState() : current.to();
			if (symbols.size() >= MAX_LABEL_SYMBOLS || !seen.add(next)) {
				truncated = true;
				break;
			}
			NetworkState state = states.get(next);
			if (state == null || state.isRuleStop()) {
				break;
			}
			List<Transition> outgoing = transitionsFrom(next);
			if (outgoing.size() != 1) {
				truncated = outgoing.size() > 1;
				break;
			}
			current = outgoing.get(0);
		}
		if (symbols.isEmpty()) {
			NetworkState target = states.get(entry.to());
			return truncated || target == null ? "ε ..." : "(end of " + ruleName(target.ruleId()) + ")";
		}
		String path = String.join(" ", symbols);
		return truncated ? path + " ..." : path;
	}

	private RuleInfo requireRule(int ruleId) {
		RuleInfo rule = rules.get(ruleId);
		if (rule == null) {
			throw new IllegalArgumentException("Unknown rule id: " + ruleId);
		}
		return rule;
	}

	private String describe(Transition transition) {
		return switch (transition.kind()) {
			case EPSILON -> "ε";
			case PRECEDENCE -> transition.label() != null ? transition.label() : "precedence";
			case RULE_CALL -> ruleName(transition.calledRule());
			case TOKEN -> transition.tokenTypes().stream()
					.sorted()
					.map(this::tokenName)
					.collect(Collectors.joining("|"));
		};
	}

	private record RuleInfo(int id, String name, int startState, int stopState) {
	}

	/**
	 * Collects states, transitions, rules and token names. Transition labels are resolved when
	 * the network is built, so names may be registered in any order.
	 */
	public static final class Builder {

		private final Map<Integer, NetworkState> states = new LinkedHashMap<>();
		private final Map<Integer, List<Transition>> transitions = new LinkedHashMap<>();
		private final Map<Integer, RuleInfo> rules = new LinkedHashMap<>();
		private final Map<Integer, String> tokenNames = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder rule(int ruleId, String name, int startState, int stopState) {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Rule " + ruleId + " needs a name");
			}
			rules.put(ruleId, new RuleInfo(ruleId, name, startState, stopState));
			state(startState, ruleId, StateKind.RULE_START);
			state(stopState, ruleId, StateKind.RULE_STOP);
			return this;
		}

		public Builder state(int id, int ruleId, StateKind kind) {
			NetworkState existing = states.get(id);
			if (existing != null && existing.kind() != kind) {
				throw new IllegalArgumentException("State " + id + " already declared as " + existing.kind());
			}
			states.put(id, new NetworkState(id, ruleId, kind));
			return this;
		}

		public Builder tokenName(int tokenType, String name) {
			tokenNames.put(tokenType, name);
			return this;
		}

		public Builder transition(Transition transition) {
			transitions.computeIfAbsent(transition.from(), ignored -> new ArrayList<>()).add(transition);
			return this;
		}

		public Builder epsilon(int from, int to) {
			return transition(Transition.epsilon(from, to));
		}

		public Builder token(int from, int to, Integer... tokenTypes) {
			return transition(Transition.token(from, to, Set.of(tokenTypes)));
		}

		public Builder ruleCall(int from, int calledRule, int followState) {
			RuleInfo called = rules.get(calledRule);
			if (called == null) {
				throw new IllegalArgumentException("Rule " + calledRule + " must be declared before it is called");
			}
			return transition(Transition.ruleCall(from, called.startState(), calledRule, followState));
		}

		public TransitionNetwork build() {
			for (List<Transition> outgoing : transitions.values()) {
				for (Transition transition : outgoing) {
					requireState(transition.from(), transition);
					requireState(transition.to(), transition);
					if (transition.kind() == TransitionKind.RULE_CALL) {
						if (!rules.containsKey(transition.calledRule())) {
							throw new IllegalArgumentException("Transition " + transition + " calls an unknown rule");
						}
						requireState(transition.followState(), transition);
					}
				}
			}
			TransitionNetwork unlabelled = new TransitionNetwork(this);
			for (List<Transition> outgoing : transitions.values()) {
				outgoing.replaceAll(transition -> transition.label() != null
						? transition
						: transition.withLabel(unlabelled.describe(transition)));
			}
			return new TransitionNetwork(this);
		}

		private void requireState(int id, Transition transition) {
			if (!states.containsKey(id)) {
				throw new IllegalArgumentException("Transition " + transition.from() + " -> " + transition.to()
						+ " references undeclared state " + id);
			}
		}
	}
}

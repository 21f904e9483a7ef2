package org.javai.paredros.antlr;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.DecisionState;
import org.antlr.v4.runtime.atn.NotSetTransition;
import org.antlr.v4.runtime.atn.PrecedencePredicateTransition;
import org.antlr.v4.runtime.atn.RuleStartState;
import org.antlr.v4.runtime.atn.RuleStopState;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.atn.WildcardTransition;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.javai.paredros.network.StateKind;
import org.javai.paredros.network.TransitionNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an ANTLR parser ATN onto a {@link TransitionNetwork}.
 * <p>
 * State numbers and transition order are kept, so ANTLR's predicted alternatives line up with the
 * network's alternative numbering. Follow links out of rule stop states are left out; returns are
 * modelled by call frames.
 */
public final class AntlrNetworkAdapter {

	private static final Logger logger = LoggerFactory.getLogger(AntlrNetworkAdapter.class);

	private AntlrNetworkAdapter() {
	}

	public static TransitionNetwork adapt(ATN atn, Vocabulary vocabulary, List<String> ruleNames) {
		TransitionNetwork.Builder builder = TransitionNetwork.builder();
		for (int type = Token.MIN_USER_TOKEN_TYPE; type <= atn.maxTokenType; type++) {
			builder.tokenName(type, tokenName(vocabulary, type));
		}
		for (int rule = 0; rule < atn.ruleToStartState.length; rule++) {
			String name = rule < ruleNames.size() ? ruleNames.get(rule) : "rule" + rule;
			builder.rule(rule, name, atn.ruleToStartState[rule].stateNumber, atn.ruleToStopState[rule].stateNumber);
		}
		for (ATNState state : atn.states) {
			if (state != null) {
				builder.state(state.stateNumber, state.ruleIndex, kindOf(state));
			}
		}
		for (ATNState state : atn.states) {
			if (state == null || state instanceof RuleStopState) {
				continue;
			}
			for (int i = 0; i < state.getNumberOfTransitions(); i++) {
				addTransition(builder, atn, state, state.transition(i));
			}
		}
		TransitionNetwork network = builder.build();
		logger.debug("Adapted ATN with {} states and {} rules", network.stateCount(), network.ruleCount());
		return network;
	}

	/**
	 * Display name of a token type: its symbolic name, or the literal for implicit tokens.
	 */
	public static String tokenName(Vocabulary vocabulary, int type) {
		if (type == Token.EOF) {
			return "EOF";
		}
		String symbolic = vocabulary.getSymbolicName(type);
		if (symbolic != null && !symbolic.startsWith("T__")) {
			return symbolic;
		}
		return vocabulary.getDisplayName(type);
	}

	static StateKind kindOf(ATNState state) {
		if (state instanceof RuleStartState) {
			return StateKind.RULE_START;
		}
		if (state instanceof RuleStopState) {
			return StateKind.RULE_STOP;
		}
		if (state instanceof DecisionState && state.getNumberOfTransitions() > 1) {
			return StateKind.DECISION;
		}
		if (state.getNumberOfTransitions() == 1 && !state.transition(0).isEpsilon()) {
			return StateKind.TOKEN_MATCH;
		}
		return StateKind.BASIC;
	}

	private static void addTransition(TransitionNetwork.Builder builder, ATN atn, ATNState from, Transition transition) {
		int to = transition.target.stateNumber;
		if (transition instanceof RuleTransition) {
			RuleTransition call = (RuleTransition) transition;
			builder.ruleCall(from.stateNumber, call.ruleIndex, call.followState.stateNumber);
		} else if (transition instanceof PrecedencePredicateTransition) {
			int precedence = ((PrecedencePredicateTransition) transition).precedence;
			builder.transition(org.javai.paredros.network.Transition.precedence(from.stateNumber, to,
					"precedence >= " + precedence));
		} else if (transition.isEpsilon()) {
			builder.epsilon(from.stateNumber, to);
		} else {
			Set<Integer> types = matchedTypes(atn, transition);
			if (types.isEmpty()) {
				logger.warn("Transition {} -> {} matches no token type; treating it as epsilon", from.stateNumber, to);
				builder.epsilon(from.stateNumber, to);
			} else {
				builder.transition(org.javai.paredros.network.Transition.token(from.stateNumber, to, types));
			}
		}
	}

	private static Set<Integer> matchedTypes(ATN atn, Transition transition) {
		IntervalSet all = IntervalSet.of(Token.MIN_USER_TOKEN_TYPE, atn.maxTokenType);
		IntervalSet matched;
		if (transition instanceof WildcardTransition) {
			matched = all;
		} else if (transition instanceof NotSetTransition) {
			matched = transition.label().complement(all);
		} else {
			matched = transition.label();
		}
		return matched != null ? new TreeSet<>(matched.toList()) : Set.of();
	}
}

package org.javai.paredros.traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.javai.paredros.config.DebuggerSettings;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.CallFrame;
import org.javai.paredros.network.NetworkState;
import org.javai.paredros.network.Transition;
import org.javai.paredros.network.TransitionNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives what an unchosen alternative would have done with the same input, without running the
 * parser again.
 * <p>
 * The walk starts at the decision's input position and call stack and follows the network,
 * consuming input tokens. It ends at a leaf (mismatch, missing input, end of parse, step limit) or
 * at a nested decision the next token does not settle. A nested decision no alternative of which
 * admits the next token is followed by a mismatch leaf. The subgraph is attached to the alternative
 * and reused on later requests.
 */
public class AlternativeExpander {

	private static final Logger logger = LoggerFactory.getLogger(AlternativeExpander.class);

	private final DebuggerSettings settings;

	public AlternativeExpander(DebuggerSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	/**
	 * Root step of the given alternative's subgraph.
	 *
	 * @return the id of the subgraph root; for the decision's chosen alternative, the next step of
	 * the path it belongs to
	 * @throws IllegalArgumentException if the step is not a decision or the index is out of range
	 */
	public int expand(TraversalGraph graph, TraversalNode decision, int index) {
		if (!decision.isDecision()) {
			throw new IllegalArgumentException("Step " + decision.id() + " is not a decision");
		}
		Alternative alternative = decision.alternative(index)
				.orElseThrow(() -> new IllegalArgumentException("Alternative " + index + " out of range 1.."
						+ decision.alternatives().size() + " at step " + decision.id()));
		if (alternative.isExpanded()) {
			return alternative.subgraphRootId();
		}
		if (decision.isChoiceKnown() && decision.chosenAlternative().get() == index && decision.hasNext()) {
			return decision.nextId();
		}
		Walk walk = new Walk(graph, decision);
		walk.run(alternative.entry());
		alternative.attachSubgraph(walk.rootId);
		logger.debug("Expanded alternative {} of step {} into {} steps", index, decision.id(), walk.created);
		return walk.rootId;
	}

	/**
	 * Whether a path starting with {@code entry} can consume {@code tokenType} as its next token,
	 * looking through rule calls and, via {@code callStack}, through returns into callers.
	 */
	boolean admits(TransitionNetwork network, Transition entry, List<CallFrame> callStack, int tokenType) {
		return firstTokens(network, entry, callStack).admits(tokenType);
	}

	/**
	 * Token transitions a path starting with {@code entry} can take first, and whether it can end
	 * the parse without consuming anything.
	 */
	FirstTokens firstTokens(TransitionNetwork network, Transition entry, List<CallFrame> callStack) {
		List<Transition> tokens = new ArrayList<>();
		boolean canEnd = false;
		Deque<Pending> work = new ArrayDeque<>();
		Set<Pending> seen = new HashSet<>();
		work.push(new Pending(entry, List.copyOf(callStack)));
		int budget = settings.maxExpansionSteps();
		while (!work.isEmpty() && budget-- > 0) {
			Pending pending = work.pop();
			if (!seen.add(pending)) {
				continue;
			}
			Transition transition = pending.transition();
			List<CallFrame> stack = pending.stack();
			int target;
			switch (transition.kind()) {
				case TOKEN -> {
					tokens.add(transition);
					continue;
				}
				case RULE_CALL -> {
					if (stack.size() >= settings.maxCallDepth()) {
						continue;
					}
					stack = push(stack, new CallFrame(transition.calledRule(), transition.followState()));
					target = transition.to();
				}
				default -> target = transition.to();
			}
			NetworkState state = network.state(target).orElse(null);
			if (state == null) {
				continue;
			}
			if (state.isRuleStop()) {
				if (stack.isEmpty() || !stack.get(stack.size() - 1).hasReturnState()) {
					canEnd = true;
					continue;
				}
				CallFrame top = stack.get(stack.size() - 1);
				work.push(new Pending(Transition.epsilon(target, top.returnStateId()),
						List.copyOf(stack.subList(0, stack.size() - 1))));
				continue;
			}
			for (Transition next : network.transitionsFrom(target)) {
				work.push(new Pending(next, stack));
			}
		}
		return new FirstTokens(List.copyOf(tokens), canEnd);
	}

	private static List<CallFrame> push(List<CallFrame> stack, CallFrame frame) {
		List<CallFrame> pushed = new ArrayList<>(stack);
		pushed.add(frame);
		return List.copyOf(pushed);
	}

	private record Pending(Transition transition, List<CallFrame> stack) {
	}

	record FirstTokens(List<Transition> transitions, boolean canEnd) {

		boolean admits(int tokenType) {
			if (tokenType == TokenInfo.EOF_TYPE && canEnd) {
				return true;
			}
			return transitions.stream().anyMatch(transition -> transition.matches(tokenType));
		}

		Set<String> labels() {
			Set<String> labels = new TreeSet<>();
			transitions.forEach(transition -> labels.add(transition.label()));
			if (canEnd) {
				labels.add("EOF");
			}
			return labels;
		}
	}

	private record Config(int stateId, List<CallFrame> stack) {
	}

	/**
	 * One walk through the network, appending synthetic steps behind the decision.
	 */
	private final class Walk {

		private final TraversalGraph graph;
		private final TransitionNetwork network;
		private final TraversalNode decision;
		private final List<CallFrame> stack;
		private final Set<Config> seenSinceLastToken = new HashSet<>();

		private int position;
		private TraversalNode previous;
		private int rootId = TraversalNode.NONE;
		private int created;
		private int steps;

		private Walk(TraversalGraph graph, TraversalNode decision) {
			this.graph = graph;
			this.network = graph.network();
			this.decision = decision;
			this.stack = new ArrayList<>(decision.callStack());
			this.position = decision.inputPosition();
		}

		private void run(Transition entry) {
			Transition transition = entry;
			while (transition != null) {
				if (++steps > settings.maxExpansionSteps()) {
					leaf(NodeKind.EXPANSION_LIMIT, transition.from(),
							"stopped after " + settings.maxExpansionSteps() + " steps");
					return;
				}
				Integer next = follow(transition);
				if (next == null) {
					return;
				}
				transition = arrive(next);
			}
		}

		/**
		 * Takes a transition; returns the state reached, or null when the walk ended.
		 */
		private Integer follow(Transition transition) {
			return switch (transition.kind()) {
				case EPSILON, PRECEDENCE -> transition.to();
				case TOKEN -> consume(transition);
				case RULE_CALL -> call(transition);
			};
		}

		private Integer consume(Transition transition) {
			TokenInfo token = graph.tokenAt(position);
			if (transition.matches(token.type())) {
				position++;
				seenSinceLastToken.clear();
				append(NodeKind.TOKEN_CONSUME, transition.from(), List.of());
				return transition.to();
			}
			String expected = "expected " + transition.label() + " but found " + token;
			if (token.isEof()) {
				leaf(NodeKind.INSUFFICIENT_INPUT, transition.from(), expected);
			} else {
				leaf(NodeKind.MISMATCH, transition.from(), expected);
			}
			return null;
		}

		private Integer call(Transition transition) {
			if (stack.size() >= settings.maxCallDepth()) {
				leaf(NodeKind.EXPANSION_LIMIT, transition.from(),
						"call depth " + settings.maxCallDepth() + " reached");
				return null;
			}
			stack.add(new CallFrame(transition.calledRule(), transition.followState()));
			append(NodeKind.RULE_ENTER, transition.to(), List.of());
			return transition.to();
		}

		/**
		 * Handles arrival at a state; returns the transition to follow next, or null when the walk
		 * ended.
		 */
		private Transition arrive(int stateId) {
			NetworkState state = network.state(stateId).orElse(null);
			if (state == null) {
				leaf(NodeKind.PARSE_ERROR, stateId, "unknown state " + stateId);
				return null;
			}
			if (!seenSinceLastToken.add(new Config(stateId, List.copyOf(stack)))) {
				leaf(NodeKind.EXPANSION_LIMIT, stateId, "state " + stateId + " revisited without consuming input");
				return null;
			}
			if (state.isRuleStop()) {
				return returnFrom(state);
			}
			List<Transition> outgoing = network.transitionsFrom(stateId);
			if (outgoing.isEmpty()) {
				leaf(NodeKind.PARSE_ERROR, stateId, "no transition leaves state " + stateId);
				return null;
			}
			if (outgoing.size() == 1) {
				return outgoing.get(0);
			}
			return branch(stateId, outgoing);
		}

		private Transition returnFrom(NetworkState stop) {
			CallFrame top = stack.isEmpty() ? null : stack.get(stack.size() - 1);
			if (top != null) {
				append(NodeKind.RULE_EXIT, stop.id(), List.of());
				stack.remove(stack.size() - 1);
				if (top.hasReturnState()) {
					return Transition.epsilon(stop.id(), top.returnStateId());
				}
			}
			List<TokenInfo> remaining = graph.remainingTokens(position);
			if (remaining.isEmpty()) {
				leaf(NodeKind.END_OF_PARSE, stop.id(), null);
			} else {
				leaf(NodeKind.MISMATCH, stop.id(), "parse would end with input left: " + remaining.stream()
						.map(TokenInfo::toString)
						.collect(Collectors.joining(" ")));
			}
			return null;
		}

		private Transition branch(int stateId, List<Transition> outgoing) {
			List<Alternative> alternatives = Alternatives.forDecision(network, stateId, List.of());
			TraversalNode node = append(NodeKind.DECISION, stateId, alternatives);
			if (!settings.resolveLl1Decisions()) {
				return null;
			}
			TokenInfo token = graph.tokenAt(position);
			Set<String> expected = new TreeSet<>();
			int admitted = 0;
			for (int i = 0; i < outgoing.size(); i++) {
				FirstTokens first = firstTokens(network, outgoing.get(i), stack);
				if (first.admits(token.type())) {
					if (admitted != 0) {
						return null;
					}
					admitted = i + 1;
				}
				expected.addAll(first.labels());
			}
			if (admitted == 0) {
				String detail = "no alternative admits " + token + "; expected one of " + expected;
				leaf(token.isEof() ? NodeKind.INSUFFICIENT_INPUT : NodeKind.MISMATCH, stateId, detail);
				return null;
			}
			node.resolveChosen(admitted);
			return outgoing.get(admitted - 1);
		}

		private void leaf(NodeKind kind, int stateId, String detail) {
			TraversalNode node = append(kind, stateId, List.of());
			TerminalStatus status = kind == NodeKind.END_OF_PARSE ? TerminalStatus.ACCEPTED : TerminalStatus.REJECTED;
			node.markTerminal(status, detail);
		}

		private TraversalNode append(NodeKind kind, int stateId, List<Alternative> alternatives) {
			int ruleId = network.state(stateId).map(NetworkState::ruleId).orElse(-1);
			int parentId = previous != null ? previous.id() : decision.id();
			TraversalNode node = graph.add(parentId, kind, stateId, ruleId, stack, position, true, alternatives,
					graph.lookaheadAt(position));
			if (previous != null) {
				previous.linkNext(node.id());
			} else {
				rootId = node.id();
			}
			previous = node;
			created++;
			return node;
		}
	}
}

package org.javai.paredros.traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import org.javai.paredros.event.ParseEvent;
import org.javai.paredros.event.ParseEventKind;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.CallFrame;
import org.javai.paredros.network.NetworkState;
import org.javai.paredros.network.Transition;
import org.javai.paredros.network.TransitionNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works out which alternative a decision took when the engine did not say.
 * <p>
 * Each alternative is walked through the network against what happened after the decision: the
 * rule entries, rule exits and token consumptions that follow it. The first alternative whose walk
 * reproduces that suffix wins. Nested decisions are searched exhaustively, bounded by a budget of
 * visited configurations and a maximum call depth.
 */
public final class ChosenAlternativeInference {

	private static final Logger logger = LoggerFactory.getLogger(ChosenAlternativeInference.class);

	private final TransitionNetwork network;
	private final int budget;
	private final int maxCallDepth;

	public ChosenAlternativeInference(TransitionNetwork network, int budget, int maxCallDepth) {
		this.network = Objects.requireNonNull(network, "network");
		this.budget = budget;
		this.maxCallDepth = maxCallDepth;
	}

	/**
	 * @param alternatives the decision's alternatives in order
	 * @param suffix events reported after the decision
	 * @param callStack call frames active at the decision, outermost first
	 * @param tokens the run's tokens
	 * @param accepted whether the run completed without error
	 * @return the chosen alternative's index, or empty when no alternative fits
	 */
	public OptionalInt infer(List<Alternative> alternatives, List<ParseEvent> suffix, List<CallFrame> callStack,
			List<TokenInfo> tokens, boolean accepted) {
		List<Observation> observed = observe(suffix, tokens);
		if (!accepted && observed.isEmpty()) {
			return OptionalInt.empty();
		}
		for (Alternative alternative : alternatives) {
			if (isConsistent(alternative.entry(), observed, List.copyOf(callStack), accepted)) {
				return OptionalInt.of(alternative.index());
			}
		}
		return OptionalInt.empty();
	}

	private List<Observation> observe(List<ParseEvent> suffix, List<TokenInfo> tokens) {
		List<Observation> observed = new ArrayList<>();
		for (ParseEvent event : suffix) {
			if (!event.isObservable()) {
				continue;
			}
			int tokenType = TokenInfo.EOF_TYPE;
			if (event.kind() == ParseEventKind.TOKEN_CONSUME
					&& event.tokenIndex() >= 0 && event.tokenIndex() < tokens.size()) {
				tokenType = tokens.get(event.tokenIndex()).type();
			}
			observed.add(new Observation(event.kind(), event.ruleId(), tokenType));
		}
		return observed;
	}

	private boolean isConsistent(Transition entry, List<Observation> observed, List<CallFrame> callStack,
			boolean accepted) {
		Search search = new Search(observed, accepted);
		search.take(entry, 0, callStack);
		while (!search.work.isEmpty()) {
			if (search.visitedCount > budget) {
				logger.debug("Inference budget of {} configurations exhausted for alternative entering state {}",
						budget, entry.to());
				return false;
			}
			Step step = search.work.pop();
			if (search.process(step)) {
				return true;
			}
		}
		return false;
	}

	private record Observation(ParseEventKind kind, int ruleId, int tokenType) {
	}

	private record Step(Transition transition, int position, List<CallFrame> stack) {
	}

	private record Config(int stateId, int position, List<CallFrame> stack) {
	}

	private final class Search {

		private final List<Observation> observed;
		private final boolean accepted;
		private final Deque<Step> work = new ArrayDeque<>();
		private final Set<Config> visited = new HashSet<>();
		private int visitedCount;

		private Search(List<Observation> observed, boolean accepted) {
			this.observed = observed;
			this.accepted = accepted;
		}

		private void take(Transition transition, int position, List<CallFrame> stack) {
			work.push(new Step(transition, position, stack));
		}

		/**
		 * Follows one transition; true when the walk is consistent with the observations.
		 */
		private boolean process(Step step) {
			Transition transition = step.transition();
			int position = step.position();
			if (!accepted && position == observed.size()) {
				return true;
			}
			return switch (transition.kind()) {
				case EPSILON, PRECEDENCE -> arrive(transition.to(), position, step.stack());
				case TOKEN -> matchToken(transition, position, step.stack());
				case RULE_CALL -> enterRule(transition, position, step.stack());
			};
		}

		private boolean matchToken(Transition transition, int position, List<CallFrame> stack) {
			if (position < observed.size()) {
				Observation next = observed.get(position);
				if (next.kind() == ParseEventKind.TOKEN_CONSUME && transition.matches(next.tokenType())) {
					return arrive(transition.to(), position + 1, stack);
				}
				return false;
			}
			// past the suffix of an accepted run only the end of input remains
			return transition.matches(TokenInfo.EOF_TYPE) && arrive(transition.to(), position, stack);
		}

		private boolean enterRule(Transition transition, int position, List<CallFrame> stack) {
			if (stack.size() >= maxCallDepth) {
				return false;
			}
			List<CallFrame> pushed = push(stack, new CallFrame(transition.calledRule(), transition.followState()));
			if (position < observed.size()) {
				Observation next = observed.get(position);
				if (next.kind() == ParseEventKind.RULE_ENTER && next.ruleId() == transition.calledRule()) {
					return arrive(transition.to(), position + 1, pushed);
				}
				return false;
			}
			return arrive(transition.to(), position, pushed);
		}

		private boolean arrive(int stateId, int position, List<CallFrame> stack) {
			if (!accepted && position == observed.size()) {
				return true;
			}
			if (!visited.add(new Config(stateId, position, stack))) {
				return false;
			}
			visitedCount++;
			NetworkState state = network.state(stateId).orElse(null);
			if (state == null) {
				return false;
			}
			if (state.isRuleStop()) {
				return exitRule(state, position, stack);
			}
			List<Transition> outgoing = network.transitionsFrom(stateId);
			for (int i = outgoing.size() - 1; i >= 0; i--) {
				take(outgoing.get(i), position, stack);
			}
			return false;
		}

		private boolean exitRule(NetworkState stop, int position, List<CallFrame> stack) {
			int after = position;
			boolean exitObserved = position < observed.size()
					&& observed.get(position).kind() == ParseEventKind.RULE_EXIT
					&& observed.get(position).ruleId() == stop.ruleId();
			if (stack.isEmpty()) {
				return noTokenConsumedFrom(exitObserved ? position + 1 : position);
			}
			CallFrame top = stack.get(stack.size() - 1);
			if (top.ruleId() != stop.ruleId()) {
				return false;
			}
			if (exitObserved) {
				after = position + 1;
			} else if (position < observed.size()) {
				return false;
			}
			List<CallFrame> popped = stack.subList(0, stack.size() - 1);
			if (!top.hasReturnState()) {
				return noTokenConsumedFrom(after);
			}
			return arrive(top.returnStateId(), after, List.copyOf(popped));
		}

		private boolean noTokenConsumedFrom(int position) {
			for (int i = position; i < observed.size(); i++) {
				if (observed.get(i).kind() == ParseEventKind.TOKEN_CONSUME) {
					return false;
				}
			}
			return true;
		}

		private List<CallFrame> push(List<CallFrame> stack, CallFrame frame) {
			List<CallFrame> pushed = new ArrayList<>(stack.size() + 1);
			pushed.addAll(stack);
			pushed.add(frame);
			return List.copyOf(pushed);
		}
	}
}

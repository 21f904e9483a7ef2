package org.javai.paredros.traversal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import org.javai.paredros.config.DebuggerSettings;
import org.javai.paredros.event.ParseError;
import org.javai.paredros.event.ParseEvent;
import org.javai.paredros.event.ParseEventListener;
import org.javai.paredros.event.ParseEventStream;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.CallFrame;
import org.javai.paredros.network.NetworkState;
import org.javai.paredros.network.TransitionNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a parse event stream into a {@link TraversalGraph}.
 * <p>
 * The builder is a {@link ParseEventListener}, so an engine can drive it while it parses, or a
 * recorded {@link ParseEventStream} can be replayed into it. Every rule entry, rule exit and token
 * consumption appends one step after the previous one. Decisions become steps that hold all their
 * alternatives; choices the engine did not report are inferred once the run has ended.
 * <p>
 * Construction stops for good at the first error signal or at completion, and the graph freezes.
 * Events that contradict the network raise {@link ConstructionException}.
 */
public class TraversalGraphBuilder implements ParseEventListener {

	private static final Logger logger = LoggerFactory.getLogger(TraversalGraphBuilder.class);

	private final TransitionNetwork network;
	private final DebuggerSettings settings;
	private final List<ParseEvent> events = new ArrayList<>();
	private final List<CallFrame> callStack = new ArrayList<>();
	private final Map<Integer, Integer> unresolvedDecisions = new LinkedHashMap<>();

	private TraversalGraph graph;
	private TraversalNode last;
	private int position;

	public TraversalGraphBuilder(TransitionNetwork network, DebuggerSettings settings) {
		this.network = Objects.requireNonNull(network, "network");
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	public static TraversalGraph build(TransitionNetwork network, ParseEventStream stream, DebuggerSettings settings) {
		TraversalGraphBuilder builder = new TraversalGraphBuilder(network, settings);
		stream.replay(builder);
		return builder.graph();
	}

	/**
	 * The finished graph.
	 *
	 * @throws IllegalStateException if the run has not ended yet
	 */
	public TraversalGraph graph() {
		if (graph == null || !graph.isFrozen()) {
			throw new IllegalStateException("Graph is not complete until the run ends");
		}
		return graph;
	}

	@Override
	public void onParseStart(List<TokenInfo> tokens) {
		if (graph != null) {
			throw new IllegalStateException("Parse already started");
		}
		List<TokenInfo> all = new ArrayList<>(tokens);
		if (all.isEmpty() || !all.get(all.size() - 1).isEof()) {
			all.add(TokenInfo.eof(all.size()));
		}
		for (int i = 0; i < all.size(); i++) {
			if (all.get(i).index() != i) {
				throw new ConstructionException("Token " + all.get(i) + " has index " + all.get(i).index()
						+ " but sits at position " + i);
			}
		}
		graph = new TraversalGraph(network, all, settings.lookaheadDepth());
		logger.debug("Building traversal graph over {} tokens", all.size());
	}

	@Override
	public void onEvent(ParseEvent event) {
		requireOpen();
		NetworkState state = network.state(event.stateId())
				.orElseThrow(() -> new ConstructionException("Event " + event.kind() + " refers to unknown state "
						+ event.stateId()));
		if (!network.hasRule(event.ruleId())) {
			throw new ConstructionException("Event " + event.kind() + " at state " + state.id()
					+ " refers to unknown rule " + event.ruleId());
		}
		events.add(event);
		switch (event.kind()) {
			case RULE_ENTER -> enterRule(event);
			case RULE_EXIT -> exitRule(event);
			case TOKEN_CONSUME -> consumeToken(event);
			case DECISION_ENTER -> decide(event);
		}
	}

	@Override
	public void onError(ParseError error) {
		requireOpen();
		if (last == null) {
			int ruleId = callStack.isEmpty() ? -1 : callStack.get(callStack.size() - 1).ruleId();
			last = append(NodeKind.PARSE_ERROR, error.stateId(), ruleId, List.of());
		}
		last.markTerminal(TerminalStatus.REJECTED, error.message());
		logger.warn("Parse rejected at step {} (token {}): {}", last.id(), error.tokenIndex(), error.message());
		finish(TerminalStatus.REJECTED, error);
	}

	@Override
	public void onComplete() {
		requireOpen();
		if (last == null) {
			throw new ConstructionException("Parse completed without reporting any event");
		}
		if (!callStack.isEmpty()) {
			throw new ConstructionException("Parse completed while rule "
					+ network.ruleName(callStack.get(callStack.size() - 1).ruleId()) + " is open");
		}
		List<TokenInfo> remaining = graph.remainingTokens(position);
		if (!remaining.isEmpty()) {
			String message = "input not fully consumed: " + remaining.stream()
					.map(TokenInfo::toString)
					.collect(Collectors.joining(" "));
			ParseError error = new ParseError(position, last.stateId(), message);
			last.markTerminal(TerminalStatus.REJECTED, message);
			logger.warn("Parse rejected at step {} (token {}): {}", last.id(), position, message);
			finish(TerminalStatus.REJECTED, error);
			return;
		}
		last.markTerminal(TerminalStatus.ACCEPTED, null);
		finish(TerminalStatus.ACCEPTED, null);
	}

	private void enterRule(ParseEvent event) {
		callStack.add(new CallFrame(event.ruleId(), event.returnStateId()));
		append(NodeKind.RULE_ENTER, event.stateId(), event.ruleId(), List.of());
	}

	private void exitRule(ParseEvent event) {
		if (callStack.isEmpty()) {
			throw new ConstructionException("Exit from rule " + network.ruleName(event.ruleId())
					+ " without a matching entry");
		}
		CallFrame top = callStack.get(callStack.size() - 1);
		if (top.ruleId() != event.ruleId()) {
			throw new ConstructionException("Exit from rule " + network.ruleName(event.ruleId())
					+ " while rule " + network.ruleName(top.ruleId()) + " is open");
		}
		append(NodeKind.RULE_EXIT, event.stateId(), event.ruleId(), List.of());
		callStack.remove(callStack.size() - 1);
	}

	private void consumeToken(ParseEvent event) {
		if (event.tokenIndex() != position) {
			throw new ConstructionException("Token " + event.tokenIndex() + " consumed at input position " + position);
		}
		if (position >= graph.tokens().size()) {
			throw new ConstructionException("Token " + event.tokenIndex() + " consumed past the end of input");
		}
		position++;
		append(NodeKind.TOKEN_CONSUME, event.stateId(), event.ruleId(), List.of());
	}

	private void decide(ParseEvent event) {
		List<Alternative> alternatives = Alternatives.forDecision(network, event.stateId(),
				event.availableAlternatives());
		if (alternatives.isEmpty()) {
			throw new ConstructionException("Decision at state " + event.stateId() + " has no alternatives");
		}
		Integer chosen = event.chosenAlternative();
		if (chosen != null && (chosen < 1 || chosen > alternatives.size())) {
			throw new ConstructionException("Decision at state " + event.stateId() + " chose alternative " + chosen
					+ " of " + alternatives.size());
		}
		if (settings.mergeDuplicateDecisions() && isRepeatOfLastDecision(event)) {
			mergeInto(last, chosen);
			return;
		}
		List<TokenInfo> lookahead = event.lookahead().isEmpty() ? graph.lookaheadAt(position) : event.lookahead();
		TraversalNode node = graph.add(parentId(), NodeKind.DECISION, event.stateId(), event.ruleId(),
				callStack, position, false, alternatives, lookahead);
		link(node);
		if (chosen != null) {
			node.resolveChosen(chosen);
		} else {
			unresolvedDecisions.put(node.id(), events.size() - 1);
		}
	}

	private boolean isRepeatOfLastDecision(ParseEvent event) {
		return last != null
				&& last.isDecision()
				&& last.stateId() == event.stateId()
				&& last.inputPosition() == position;
	}

	private void mergeInto(TraversalNode decision, Integer chosen) {
		if (chosen == null) {
			return;
		}
		if (decision.isChoiceKnown() && decision.chosenAlternative().get().intValue() != chosen) {
			throw new ConstructionException("Decision at state " + decision.stateId() + " reported alternatives "
					+ decision.chosenAlternative().get() + " and " + chosen + " at the same input position");
		}
		decision.resolveChosen(chosen);
		unresolvedDecisions.remove(decision.id());
	}

	private TraversalNode append(NodeKind kind, int stateId, int ruleId, List<Alternative> alternatives) {
		TraversalNode node = graph.add(parentId(), kind, stateId, ruleId, callStack, position, false,
				alternatives, graph.lookaheadAt(position));
		link(node);
		return node;
	}

	private int parentId() {
		return last != null ? last.id() : TraversalNode.NONE;
	}

	private void link(TraversalNode node) {
		if (last != null) {
			last.linkNext(node.id());
		}
		last = node;
	}

	private void finish(TerminalStatus outcome, ParseError error) {
		boolean accepted = outcome == TerminalStatus.ACCEPTED;
		if (!unresolvedDecisions.isEmpty()) {
			ChosenAlternativeInference inference = new ChosenAlternativeInference(network,
					settings.inferenceBudget(), settings.maxCallDepth());
			for (Map.Entry<Integer, Integer> entry : unresolvedDecisions.entrySet()) {
				TraversalNode decision = graph.node(entry.getKey());
				List<ParseEvent> suffix = events.subList(entry.getValue() + 1, events.size());
				OptionalInt chosen = inference.infer(decision.alternatives(), suffix, decision.callStack(),
						graph.tokens(), accepted);
				if (chosen.isPresent()) {
					decision.resolveChosen(chosen.getAsInt());
					logger.debug("Inferred alternative {} at step {} (state {})", chosen.getAsInt(), decision.id(),
							decision.stateId());
				} else {
					logger.debug("Could not infer the alternative taken at step {} (state {})", decision.id(),
							decision.stateId());
				}
			}
			unresolvedDecisions.clear();
		}
		graph.finish(last.id(), outcome, error);
		logger.debug("Traversal graph complete: {} steps, outcome {}", graph.size(), outcome);
	}

	private void requireOpen() {
		if (graph == null) {
			throw new IllegalStateException("onParseStart must be called before any event");
		}
		if (graph.isFrozen()) {
			throw new IllegalStateException("Graph is frozen; the run has already ended");
		}
	}
}

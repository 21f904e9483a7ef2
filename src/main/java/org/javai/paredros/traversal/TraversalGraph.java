package org.javai.paredros.traversal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.paredros.event.ParseError;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.CallFrame;
import org.javai.paredros.network.TransitionNetwork;

/**
 * Arena of parse steps for one run, plus the run's tokens and outcome.
 * <p>
 * The chosen path is built once by {@link TraversalGraphBuilder} and then frozen. Afterwards only
 * synthetic subgraphs created by {@link AlternativeExpander} are added.
 */
public final class TraversalGraph {

	private final TransitionNetwork network;
	private final List<TokenInfo> tokens;
	private final int lookaheadDepth;
	private final List<TraversalNode> nodes = new ArrayList<>();

	private int rootId = TraversalNode.NONE;
	private int terminalId = TraversalNode.NONE;
	private TerminalStatus outcome = TerminalStatus.NONE;
	private ParseError rejection;
	private boolean frozen;

	TraversalGraph(TransitionNetwork network, List<TokenInfo> tokens, int lookaheadDepth) {
		this.network = Objects.requireNonNull(network, "network");
		this.tokens = List.copyOf(tokens);
		this.lookaheadDepth = lookaheadDepth;
	}

	public TransitionNetwork network() {
		return network;
	}

	public List<TokenInfo> tokens() {
		return tokens;
	}

	public int size() {
		return nodes.size();
	}

	public boolean contains(int id) {
		return id >= 0 && id < nodes.size();
	}

	public TraversalNode node(int id) {
		if (!contains(id)) {
			throw new IllegalArgumentException("No step with id " + id);
		}
		return nodes.get(id);
	}

	public Optional<TraversalNode> find(int id) {
		return contains(id) ? Optional.of(nodes.get(id)) : Optional.empty();
	}

	public TraversalNode root() {
		if (rootId == TraversalNode.NONE) {
			throw new IllegalStateException("Graph has no steps");
		}
		return nodes.get(rootId);
	}

	public Optional<TraversalNode> terminal() {
		return terminalId == TraversalNode.NONE ? Optional.empty() : Optional.of(nodes.get(terminalId));
	}

	public TerminalStatus outcome() {
		return outcome;
	}

	public Optional<ParseError> rejection() {
		return Optional.ofNullable(rejection);
	}

	public boolean isFrozen() {
		return frozen;
	}

	/**
	 * Steps of the live parse from the root to the terminal step.
	 */
	public List<TraversalNode> chosenPath() {
		List<TraversalNode> path = new ArrayList<>();
		int id = rootId;
		while (id != TraversalNode.NONE) {
			TraversalNode node = nodes.get(id);
			if (node.isSynthetic()) {
				break;
			}
			path.add(node);
			id = node.nextId();
		}
		return Collections.unmodifiableList(path);
	}

	/**
	 * Token at the given input position; positions past the end yield the end-of-input token.
	 */
	public TokenInfo tokenAt(int position) {
		if (position >= 0 && position < tokens.size()) {
			return tokens.get(position);
		}
		return TokenInfo.eof(Math.max(position, 0));
	}

	public List<TokenInfo> lookaheadAt(int position) {
		return lookaheadAt(position, lookaheadDepth);
	}

	public List<TokenInfo> lookaheadAt(int position, int depth) {
		List<TokenInfo> result = new ArrayList<>();
		for (int i = position; i < position + depth; i++) {
			TokenInfo token = tokenAt(i);
			result.add(token);
			if (token.isEof()) {
				break;
			}
		}
		return result;
	}

	public List<TokenInfo> consumedTokens(int position) {
		return tokens.subList(0, Math.min(Math.max(position, 0), tokens.size()));
	}

	/**
	 * Tokens not yet consumed at the given position, without the end-of-input token.
	 */
	public List<TokenInfo> remainingTokens(int position) {
		List<TokenInfo> result = new ArrayList<>();
		for (int i = Math.max(position, 0); i < tokens.size(); i++) {
			if (!tokens.get(i).isEof()) {
				result.add(tokens.get(i));
			}
		}
		return result;
	}

	TraversalNode add(int parentId, NodeKind kind, int stateId, int ruleId, List<CallFrame> callStack,
			int inputPosition, boolean synthetic, List<Alternative> alternatives, List<TokenInfo> lookahead) {
		if (frozen && !synthetic) {
			throw new IllegalStateException("Graph is frozen; only expansion steps may be added");
		}
		String ruleName = ruleId >= 0 ? network.ruleName(ruleId) : "";
		TraversalNode node = new TraversalNode(nodes.size(), parentId, kind, stateId, ruleId, ruleName, callStack,
				inputPosition, synthetic, alternatives, lookahead);
		nodes.add(node);
		if (rootId == TraversalNode.NONE) {
			rootId = node.id();
		}
		return node;
	}

	void finish(int terminalStepId, TerminalStatus finalOutcome, ParseError error) {
		if (frozen) {
			throw new IllegalStateException("Graph is already frozen");
		}
		this.terminalId = terminalStepId;
		this.outcome = finalOutcome;
		this.rejection = error;
		this.frozen = true;
	}
}

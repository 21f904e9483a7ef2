package org.javai.paredros.traversal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.CallFrame;

/**
 * One dynamic parse step. Nodes live in the arena of a {@link TraversalGraph} and refer to each
 * other by id, so a recursive rule produces fresh nodes for the same network state instead of a
 * cycle.
 * <p>
 * Relationships and decision choices are set while the graph is built or expanded and never change
 * afterwards.
 */
public final class TraversalNode {

	public static final int NONE = -1;

	private final int id;
	private final int parentId;
	private final NodeKind kind;
	private final int stateId;
	private final int ruleId;
	private final String ruleName;
	private final List<CallFrame> callStack;
	private final int inputPosition;
	private final boolean synthetic;
	private final List<Alternative> alternatives;
	private final List<TokenInfo> lookahead;

	private int nextId = NONE;
	private Integer chosenAlternative;
	private TerminalStatus terminalStatus = TerminalStatus.NONE;
	private String detail;

	TraversalNode(int id, int parentId, NodeKind kind, int stateId, int ruleId, String ruleName,
			List<CallFrame> callStack, int inputPosition, boolean synthetic, List<Alternative> alternatives,
			List<TokenInfo> lookahead) {
		this.id = id;
		this.parentId = parentId;
		this.kind = Objects.requireNonNull(kind, "kind");
		this.stateId = stateId;
		this.ruleId = ruleId;
		this.ruleName = ruleName != null ? ruleName : "";
		this.callStack = List.copyOf(callStack);
		this.inputPosition = inputPosition;
		this.synthetic = synthetic;
		this.alternatives = List.copyOf(alternatives);
		this.lookahead = List.copyOf(lookahead);
	}

	public int id() {
		return id;
	}

	public int parentId() {
		return parentId;
	}

	public boolean isRoot() {
		return parentId == NONE;
	}

	public int nextId() {
		return nextId;
	}

	public boolean hasNext() {
		return nextId != NONE;
	}

	public NodeKind kind() {
		return kind;
	}

	public int stateId() {
		return stateId;
	}

	public int ruleId() {
		return ruleId;
	}

	public String ruleName() {
		return ruleName;
	}

	/**
	 * Active rule invocations at this step, outermost first.
	 */
	public List<CallFrame> callStack() {
		return callStack;
	}

	/**
	 * Number of tokens consumed once this step has happened.
	 */
	public int inputPosition() {
		return inputPosition;
	}

	public boolean isSynthetic() {
		return synthetic;
	}

	public boolean isDecision() {
		return kind == NodeKind.DECISION;
	}

	public List<Alternative> alternatives() {
		return alternatives;
	}

	public Optional<Alternative> alternative(int index) {
		if (index < 1 || index > alternatives.size()) {
			return Optional.empty();
		}
		return Optional.of(alternatives.get(index - 1));
	}

	public Optional<Integer> chosenAlternative() {
		return Optional.ofNullable(chosenAlternative);
	}

	public boolean isChoiceKnown() {
		return chosenAlternative != null;
	}

	public List<TokenInfo> lookahead() {
		return lookahead;
	}

	public TerminalStatus terminalStatus() {
		return terminalStatus;
	}

	public boolean isTerminal() {
		return terminalStatus != TerminalStatus.NONE || kind.isLeaf();
	}

	public Optional<String> detail() {
		return Optional.ofNullable(detail);
	}

	void linkNext(int next) {
		if (nextId != NONE && nextId != next) {
			throw new IllegalStateException("Step " + id + " already continues with step " + nextId);
		}
		nextId = next;
	}

	void resolveChosen(int index) {
		if (index < 1 || index > alternatives.size()) {
			throw new IllegalArgumentException("Alternative " + index + " out of range 1.." + alternatives.size()
					+ " at step " + id);
		}
		if (chosenAlternative != null && chosenAlternative != index) {
			throw new IllegalStateException("Step " + id + " already chose alternative " + chosenAlternative);
		}
		chosenAlternative = index;
	}

	void markTerminal(TerminalStatus status, String message) {
		terminalStatus = status;
		if (message != null) {
			detail = message;
		}
	}

	@Override
	public String toString() {
		return "#" + id + " " + kind + " s" + stateId + " " + ruleName + " @" + inputPosition;
	}
}

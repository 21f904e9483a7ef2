package org.javai.paredros.navigate;

import java.util.Objects;
import org.javai.paredros.traversal.AlternativeExpander;
import org.javai.paredros.traversal.TraversalGraph;
import org.javai.paredros.traversal.TraversalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cursor over a frozen {@link TraversalGraph}.
 * <p>
 * The cursor starts at the root and walks the chosen path with {@link #moveToChild()} and
 * {@link #moveToParent()}. At a decision {@link #exploreAlternative(int)} branches into what another
 * alternative would have done; such subgraphs are computed on first visit. A failed move leaves the
 * cursor where it was.
 */
public class Navigator {

	private static final Logger logger = LoggerFactory.getLogger(Navigator.class);

	private final TraversalGraph graph;
	private final AlternativeExpander expander;
	private TraversalNode current;

	public Navigator(TraversalGraph graph, AlternativeExpander expander) {
		this.graph = Objects.requireNonNull(graph, "graph");
		this.expander = Objects.requireNonNull(expander, "expander");
		if (!graph.isFrozen()) {
			throw new IllegalStateException("Navigation needs a completed graph");
		}
		this.current = graph.root();
	}

	public TraversalGraph graph() {
		return graph;
	}

	public TraversalNode current() {
		return current;
	}

	public NavigatorState state() {
		return NavigatorState.of(current);
	}

	public StepView currentView() {
		return StepView.of(graph, current);
	}

	public MoveResult moveToChild() {
		if (current.isTerminal()) {
			return MoveResult.AT_TERMINAL;
		}
		if (current.hasNext()) {
			current = graph.node(current.nextId());
			return MoveResult.MOVED;
		}
		return current.isDecision() ? MoveResult.AWAITING_SELECTION : MoveResult.AT_TERMINAL;
	}

	public MoveResult moveToParent() {
		if (current.isRoot()) {
			return MoveResult.AT_ROOT;
		}
		current = graph.node(current.parentId());
		return MoveResult.MOVED;
	}

	/**
	 * Moves into the given alternative of the current decision. {@code 0} and the chosen
	 * alternative follow the path the step is on.
	 *
	 * @throws InvalidSelectionException if the current step is not a decision or has no such
	 * alternative
	 */
	public MoveResult exploreAlternative(int index) {
		if (!current.isDecision()) {
			throw new InvalidSelectionException("Step " + current.id() + " is a " + current.kind()
					+ " step and offers no alternatives");
		}
		if (index == 0) {
			return moveToChild();
		}
		if (index < 0 || index > current.alternatives().size()) {
			throw new InvalidSelectionException("Step " + current.id() + " offers alternatives 1.."
					+ current.alternatives().size() + ", not " + index);
		}
		if (current.chosenAlternative().map(chosen -> chosen == index).orElse(false)) {
			return moveToChild();
		}
		int rootId = expander.expand(graph, current, index);
		logger.debug("Exploring alternative {} of step {} at step {}", index, current.id(), rootId);
		current = graph.node(rootId);
		return MoveResult.MOVED;
	}

	public MoveResult jumpToStep(int stepId) {
		current = graph.find(stepId).orElseThrow(() -> new UnknownStepException(stepId));
		return MoveResult.MOVED;
	}

	/**
	 * Moves forward until a decision step is reached or no further move is possible.
	 */
	public MoveResult stepUntilNextDecision() {
		MoveResult result = moveToChild();
		while (result == MoveResult.MOVED && !current.isDecision()) {
			result = moveToChild();
		}
		return result;
	}

	/**
	 * Moves back until a decision step is reached or the root is.
	 */
	public MoveResult stepBackToPreviousDecision() {
		MoveResult result = moveToParent();
		while (result == MoveResult.MOVED && !current.isDecision()) {
			result = moveToParent();
		}
		return result;
	}
}

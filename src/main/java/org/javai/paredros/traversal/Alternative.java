package org.javai.paredros.traversal;

import java.util.Objects;
import org.javai.paredros.network.Transition;

/**
 * One candidate path out of a decision node. The subgraph is computed on first exploration and
 * kept for the lifetime of the graph.
 */
public final class Alternative {

	private final int index;
	private final Transition entry;
	private final String label;
	private int subgraphRootId = TraversalNode.NONE;

	Alternative(int index, Transition entry, String label) {
		if (index < 1) {
			throw new IllegalArgumentException("Alternatives are numbered from 1, got " + index);
		}
		this.index = index;
		this.entry = Objects.requireNonNull(entry, "entry");
		this.label = label;
	}

	public int index() {
		return index;
	}

	public int targetStateId() {
		return entry.to();
	}

	public Transition entry() {
		return entry;
	}

	public String label() {
		return label;
	}

	public boolean isExpanded() {
		return subgraphRootId != TraversalNode.NONE;
	}

	public int subgraphRootId() {
		return subgraphRootId;
	}

	void attachSubgraph(int rootId) {
		if (subgraphRootId != TraversalNode.NONE && subgraphRootId != rootId) {
			throw new IllegalStateException("Alternative " + index + " already expanded to step " + subgraphRootId);
		}
		subgraphRootId = rootId;
	}

	@Override
	public String toString() {
		return index + ": " + label;
	}
}

package org.javai.paredros.navigate;

import org.javai.paredros.traversal.NodeKind;
import org.javai.paredros.traversal.TerminalStatus;
import org.javai.paredros.traversal.TraversalNode;

public enum NavigatorState {
	ROOT,
	INTERNAL,
	DECISION,
	ACCEPTED,
	REJECTED;

	/**
	 * Terminal outcomes take precedence over the root, the root over decisions.
	 */
	public static NavigatorState of(TraversalNode node) {
		if (node.terminalStatus() != TerminalStatus.NONE) {
			return node.terminalStatus() == TerminalStatus.ACCEPTED ? ACCEPTED : REJECTED;
		}
		if (node.kind().isLeaf()) {
			return node.kind() == NodeKind.END_OF_PARSE ? ACCEPTED : REJECTED;
		}
		if (node.isRoot()) {
			return ROOT;
		}
		return node.isDecision() ? DECISION : INTERNAL;
	}
}

package org.javai.paredros.trace;

import java.util.ArrayList;
import java.util.List;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.traversal.TraversalGraph;
import org.javai.paredros.traversal.TraversalNode;

/**
 * Folds the chosen path of a graph into the grammar-shaped tree of rules and tokens.
 * <p>
 * Rule entries open a node, token consumptions add leaves and rule exits close the node. Other
 * steps are recorded as trace steps of the innermost open rule. A step outside any rule opens an
 * implicit one, and rules still open at the end of the path are closed.
 */
public final class RuleTreeBuilder {

	private RuleTreeBuilder() {
	}

	public static List<RuleTreeNode> build(TraversalGraph graph) {
		List<RuleTreeNode> roots = new ArrayList<>();
		List<Frame> open = new ArrayList<>();
		for (TraversalNode node : graph.chosenPath()) {
			switch (node.kind()) {
				case RULE_ENTER -> open.add(new Frame("r" + node.id(), node.ruleName()));
				case RULE_EXIT -> {
					if (!open.isEmpty()) {
						close(open, roots);
					}
				}
				case TOKEN_CONSUME -> {
					TokenInfo token = graph.tokenAt(node.inputPosition() - 1);
					top(open, node).children.add(RuleTreeNode.token(node.id(), node.ruleName(), token.typeName(),
							token.text()));
				}
				default -> top(open, node).traceSteps.add(node.id());
			}
		}
		while (!open.isEmpty()) {
			close(open, roots);
		}
		return roots;
	}

	private static Frame top(List<Frame> open, TraversalNode node) {
		if (open.isEmpty()) {
			open.add(new Frame("r" + node.id(), node.ruleName()));
		}
		return open.get(open.size() - 1);
	}

	private static void close(List<Frame> open, List<RuleTreeNode> roots) {
		Frame frame = open.remove(open.size() - 1);
		RuleTreeNode closed = new RuleTreeNode(frame.id, RuleTreeNode.Kind.RULE, frame.ruleName, "", "",
				frame.children, frame.traceSteps);
		if (open.isEmpty()) {
			roots.add(closed);
		} else {
			open.get(open.size() - 1).children.add(closed);
		}
	}

	private static final class Frame {

		private final String id;
		private final String ruleName;
		private final List<RuleTreeNode> children = new ArrayList<>();
		private final List<Integer> traceSteps = new ArrayList<>();

		private Frame(String id, String ruleName) {
			this.id = id;
			this.ruleName = ruleName;
		}
	}
}

package org.javai.paredros.trace;

import java.util.List;

/**
 * Node of the rule trace tree: a rule invocation with its children, or a consumed token.
 *
 * @param id {@code r<step>} for rules, {@code t<step>} for tokens, after the step that created it
 * @param kind rule or token
 * @param ruleName rule the node belongs to
 * @param tokenText text of the consumed token, empty for rules
 * @param tokenType display name of the consumed token type, empty for rules
 * @param children nested rules and tokens in input order
 * @param traceSteps decision and error steps that happened directly inside this rule
 */
public record RuleTreeNode(
		String id,
		Kind kind,
		String ruleName,
		String tokenText,
		String tokenType,
		List<RuleTreeNode> children,
		List<Integer> traceSteps
) {

	public enum Kind {
		RULE,
		TOKEN
	}

	public RuleTreeNode {
		children = List.copyOf(children);
		traceSteps = List.copyOf(traceSteps);
	}

	public static RuleTreeNode token(int stepId, String ruleName, String tokenType, String text) {
		return new RuleTreeNode("t" + stepId, Kind.TOKEN, ruleName, text, tokenType, List.of(), List.of());
	}

	/**
	 * Indented outline of the tree, one node per line.
	 */
	public String format() {
		StringBuilder sb = new StringBuilder();
		format(sb, 0);
		return sb.toString();
	}

	private void format(StringBuilder sb, int depth) {
		sb.append("  ".repeat(depth));
		if (kind == Kind.TOKEN) {
			sb.append(tokenType).append(" '").append(tokenText).append("'");
		} else {
			sb.append(ruleName);
			if (!traceSteps.isEmpty()) {
				sb.append(" ").append(traceSteps);
			}
		}
		sb.append('\n');
		for (RuleTreeNode child : children) {
			child.format(sb, depth + 1);
		}
	}
}

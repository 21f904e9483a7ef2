package org.javai.paredros.traversal;

public enum NodeKind {
	RULE_ENTER,
	RULE_EXIT,
	TOKEN_CONSUME,
	DECISION,
	PARSE_ERROR,
	INSUFFICIENT_INPUT,
	MISMATCH,
	END_OF_PARSE,
	EXPANSION_LIMIT;

	/**
	 * Leaves end a path; nothing follows them.
	 */
	public boolean isLeaf() {
		return switch (this) {
			case PARSE_ERROR, INSUFFICIENT_INPUT, MISMATCH, END_OF_PARSE, EXPANSION_LIMIT -> true;
			default -> false;
		};
	}
}

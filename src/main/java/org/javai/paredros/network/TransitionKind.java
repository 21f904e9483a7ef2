package org.javai.paredros.network;

public enum TransitionKind {
	EPSILON,
	TOKEN,
	RULE_CALL,
	PRECEDENCE;

	/**
	 * Whether following the transition neither consumes input nor enters a rule.
	 */
	public boolean isSilent() {
		return this == EPSILON || this == PRECEDENCE;
	}
}

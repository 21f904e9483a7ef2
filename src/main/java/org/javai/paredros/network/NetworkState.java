package org.javai.paredros.network;

/**
 * A state of the compiled transition network.
 *
 * @param id the state number
 * @param ruleId the rule the state belongs to
 * @param kind the structural role of the state
 */
public record NetworkState(int id, int ruleId, StateKind kind) {

	public boolean isRuleStop() {
		return kind == StateKind.RULE_STOP;
	}
}

package org.javai.paredros.network;

/**
 * One entry of a rule call stack.
 *
 * @param ruleId the invoked rule
 * @param returnStateId the state parsing resumes at once the rule exits, or
 *        {@link TransitionNetwork#NO_STATE} for the outermost rule
 */
public record CallFrame(int ruleId, int returnStateId) {

	public boolean hasReturnState() {
		return returnStateId != TransitionNetwork.NO_STATE;
	}
}

package org.javai.paredros.navigate;

import org.javai.paredros.DebuggerException;

public class UnknownStepException extends DebuggerException {

	private final int stepId;

	public UnknownStepException(int stepId) {
		super("No step with id " + stepId);
		this.stepId = stepId;
	}

	public int stepId() {
		return stepId;
	}
}

package org.javai.paredros.event;

/**
 * The engine's first-failure signal.
 */
public record ParseError(int tokenIndex, int stateId, String message) {

	public ParseError {
		message = message != null ? message : "syntax error";
	}
}

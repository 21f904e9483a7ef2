package org.javai.paredros.traversal;

import org.javai.paredros.DebuggerException;

/**
 * The event stream does not fit the transition network, or violates the event contract. A graph
 * that fails this way is never offered for navigation.
 */
public class ConstructionException extends DebuggerException {

	public ConstructionException(String message) {
		super(message);
	}

	public ConstructionException(String message, Throwable cause) {
		super(message, cause);
	}
}

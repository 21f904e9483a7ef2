package org.javai.paredros.navigate;

import org.javai.paredros.DebuggerException;

/**
 * An alternative was requested that the current step does not offer.
 */
public class InvalidSelectionException extends DebuggerException {

	public InvalidSelectionException(String message) {
		super(message);
	}
}

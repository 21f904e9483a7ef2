package org.javai.paredros;

/**
 * Base class of all exceptions raised by the debugger.
 */
public class DebuggerException extends RuntimeException {

	public DebuggerException(String message) {
		super(message);
	}

	public DebuggerException(String message, Throwable cause) {
		super(message, cause);
	}
}

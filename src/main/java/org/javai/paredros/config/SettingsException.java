package org.javai.paredros.config;

import org.javai.paredros.DebuggerException;

/**
 * Configuration could not be read or holds an invalid value.
 */
public class SettingsException extends DebuggerException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}

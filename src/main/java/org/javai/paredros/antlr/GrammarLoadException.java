package org.javai.paredros.antlr;

import java.util.List;
import org.javai.paredros.DebuggerException;

/**
 * Grammar text that the ANTLR tool could not compile.
 */
public class GrammarLoadException extends DebuggerException {

	private final List<String> problems;

	public GrammarLoadException(String message, List<String> problems) {
		super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
		this.problems = List.copyOf(problems);
	}

	public GrammarLoadException(String message, Throwable cause) {
		super(message, cause);
		this.problems = List.of();
	}

	public List<String> problems() {
		return problems;
	}
}

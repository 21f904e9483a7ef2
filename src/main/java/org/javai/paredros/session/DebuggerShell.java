package org.javai.paredros.session;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.javai.paredros.navigate.InvalidSelectionException;
import org.javai.paredros.navigate.MoveResult;
import org.javai.paredros.navigate.Navigator;
import org.javai.paredros.navigate.UnknownStepException;
import org.javai.paredros.trace.RuleTreeNode;
import org.javai.paredros.trace.TraceJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented command interpreter over a {@link DebugSession}.
 * <p>
 * An empty line moves to the next step. Navigation errors are printed and the session goes on.
 */
public class DebuggerShell {

	private static final Logger logger = LoggerFactory.getLogger(DebuggerShell.class);

	static final String HELP = String.join("\n",
			"Commands:",
			"  <enter>, c, child   move to the next step",
			"  p, parent           move to the previous step",
			"  a <n>               explore alternative n of a decision (0 follows the path)",
			"  j <id>              jump to step id",
			"  n                   move forward to the next decision",
			"  b                   move back to the previous decision",
			"  v                   show the current step",
			"  tree                show the rule tree of the parse",
			"  json                show the current step as JSON",
			"  help                show this help",
			"  q                   quit");

	private final DebugSession session;
	private final BufferedReader in;
	private final PrintWriter out;

	public DebuggerShell(DebugSession session, BufferedReader in, PrintWriter out) {
		this.session = Objects.requireNonNull(session, "session");
		this.in = Objects.requireNonNull(in, "in");
		this.out = Objects.requireNonNull(out, "out");
	}

	/**
	 * Reads commands until {@code q} or end of input.
	 */
	public void run() {
		out.println("Parse " + session.graph().outcome() + ", " + session.graph().size() + " steps");
		session.graph().rejection().ifPresent(error -> out.println("error: " + error.message()));
		show();
		try {
			String line;
			while ((line = prompt()) != null) {
				if (!execute(line.trim())) {
					break;
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read command", e);
		}
		out.flush();
	}

	/**
	 * Runs one command; false when the session should end.
	 */
	boolean execute(String command) {
		Navigator navigator = session.navigator();
		String[] parts = command.split("\\s+", 2);
		String name = parts[0];
		try {
			switch (name) {
				case "", "c", "child" -> report(navigator.moveToChild());
				case "p", "parent" -> report(navigator.moveToParent());
				case "a" -> report(navigator.exploreAlternative(number(parts)));
				case "j" -> report(navigator.jumpToStep(number(parts)));
				case "n" -> report(navigator.stepUntilNextDecision());
				case "b" -> report(navigator.stepBackToPreviousDecision());
				case "v" -> show();
				case "tree" -> {
					for (RuleTreeNode root : session.ruleTree()) {
						out.print(root.format());
					}
				}
				case "json" -> out.println(TraceJsonMapper.writePretty(TraceJsonMapper.toJson(navigator.currentView())));
				case "help" -> out.println(HELP);
				case "q", "quit" -> {
					return false;
				}
				default -> out.println("Unknown command '" + name + "'. Type help for the list of commands.");
			}
		} catch (InvalidSelectionException | UnknownStepException e) {
			logger.debug("Command '{}' rejected: {}", command, e.getMessage());
			out.println("error: " + e.getMessage());
		} catch (IllegalArgumentException e) {
			out.println("error: " + e.getMessage());
		}
		out.flush();
		return true;
	}

	private void report(MoveResult result) {
		switch (result) {
			case MOVED -> show();
			case AT_ROOT -> out.println("Already at the first step.");
			case AT_TERMINAL -> out.println("No further step: parse " + session.navigator().state() + ".");
			case AWAITING_SELECTION -> out.println("Choose an alternative with 'a <n>'.");
		}
	}

	private void show() {
		out.print(StepRenderer.render(session.navigator().currentView()));
		out.flush();
	}

	private String prompt() throws IOException {
		out.print("> ");
		out.flush();
		return in.readLine();
	}

	private static int number(String[] parts) {
		if (parts.length < 2 || parts[1].isBlank()) {
			throw new IllegalArgumentException("Command '" + parts[0] + "' needs a number");
		}
		try {
			return Integer.parseInt(parts[1].trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("'" + parts[1].trim() + "' is not a number", e);
		}
	}
}

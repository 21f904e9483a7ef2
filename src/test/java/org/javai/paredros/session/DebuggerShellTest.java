package org.javai.paredros.session;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import org.javai.paredros.config.DebuggerSettings;
import org.javai.paredros.event.ParseEventStream;
import org.javai.paredros.testsupport.SimpletonFixtures;
import org.junit.jupiter.api.Test;

class DebuggerShellTest {

	private final StringWriter output = new StringWriter();

	private DebuggerShell shell(ParseEventStream stream, DebuggerSettings settings, String commands) {
		DebugSession session = DebugSession.open(SimpletonFixtures.simpleton(), stream, settings);
		return new DebuggerShell(session, new BufferedReader(new StringReader(commands)), new PrintWriter(output));
	}

	private DebuggerShell shell(ParseEventStream stream) {
		return shell(stream, DebuggerSettings.defaults(), "");
	}

	@Test
	void walksToTheEndWithEmptyLines() {
		shell(SimpletonFixtures.oneTwoThree(), DebuggerSettings.defaults(), "\n\n\n\nq\n").run();

		String text = output.toString();
		assertThat(text).startsWith("Parse ACCEPTED, 4 steps\n● [step 0] DECISION (ROOT)\n");
		assertThat(text).contains("● [step 3] TOKEN_CONSUME (ACCEPTED)");
		assertThat(text).contains("No further step: parse ACCEPTED.");
		assertThat(text).contains("  input: 1 2 3 ⏺\n");
	}

	@Test
	void stopsAtEndOfInput() {
		shell(SimpletonFixtures.oneTwoThree(), DebuggerSettings.defaults(), "c\n").run();

		assertThat(output.toString()).contains("[step 1]").endsWith("> ");
	}

	@Test
	void announcesRejection() {
		shell(SimpletonFixtures.unknownDigit(), DebuggerSettings.defaults(), "c\nq\n").run();

		assertThat(output.toString())
				.startsWith("Parse REJECTED, 1 steps\nerror: no viable alternative at input '4'\n")
				.contains("No further step: parse REJECTED.")
				.contains("  chosen: unknown\n");
	}

	@Test
	void quitEndsTheSession() {
		DebuggerShell shell = shell(SimpletonFixtures.oneTwoThree());

		assertThat(shell.execute("q")).isFalse();
		assertThat(shell.execute("quit")).isFalse();
		assertThat(shell.execute("v")).isTrue();
	}

	@Test
	void exploresAnotherAlternative() {
		DebuggerShell shell = shell(SimpletonFixtures.oneOneOne());

		shell.execute("a 2");
		shell.execute("p");
		shell.execute("v");

		assertThat(output.toString())
				.contains("↳ [step 4] RULE_ENTER (INTERNAL)")
				.contains("  call stack: zwoelf\n")
				.contains("    2: zwoelf (explored)\n");
	}

	@Test
	void asksForASelectionAtOpenDecisions() {
		DebuggerShell shell = shell(SimpletonFixtures.oneTwoThree(),
				DebuggerSettings.defaults().withResolveLl1Decisions(false), "");

		shell.execute("a 2");
		shell.execute("n");
		shell.execute("");

		assertThat(output.toString()).contains("Choose an alternative with 'a <n>'.");
	}

	@Test
	void reportsNavigationErrorsAndCarriesOn() {
		DebuggerShell shell = shell(SimpletonFixtures.oneOneOne());

		assertThat(shell.execute("a x")).isTrue();
		assertThat(shell.execute("a")).isTrue();
		assertThat(shell.execute("a 7")).isTrue();
		assertThat(shell.execute("j 99")).isTrue();
		shell.execute("c");
		assertThat(shell.execute("a 1")).isTrue();

		assertThat(output.toString())
				.contains("error: 'x' is not a number\n")
				.contains("error: Command 'a' needs a number\n")
				.contains("error: Step 0 offers alternatives 1..4, not 7\n")
				.contains("error: No step with id 99\n")
				.contains("error: Step 1 is a TOKEN_CONSUME step and offers no alternatives\n");
	}

	@Test
	void answersUnknownCommands() {
		DebuggerShell shell = shell(SimpletonFixtures.oneOneOne());

		shell.execute("fly");
		shell.execute("p");

		assertThat(output.toString())
				.contains("Unknown command 'fly'. Type help for the list of commands.")
				.contains("Already at the first step.");
	}

	@Test
	void jumpsAndSkipsBetweenDecisions() {
		DebugSession session = DebugSession.open(SimpletonFixtures.simpleton(), SimpletonFixtures.oneOneOneTraced(),
				DebuggerSettings.defaults());
		DebuggerShell shell = new DebuggerShell(session, new BufferedReader(new StringReader("")),
				new PrintWriter(output));

		shell.execute("n");
		shell.execute("n");
		assertThat(session.navigator().current().id()).isEqualTo(3);
		shell.execute("b");
		assertThat(session.navigator().current().id()).isEqualTo(1);
		shell.execute("j 8");
		assertThat(session.navigator().current().id()).isEqualTo(8);
	}

	@Test
	void printsTreeJsonAndHelp() {
		DebuggerShell shell = shell(SimpletonFixtures.oneTwoThree());

		shell.execute("tree");
		shell.execute("json");
		shell.execute("help");

		assertThat(output.toString())
				.contains("startRule [0]\n  EINS '1'\n  ZWEI '2'\n  DREI '3'\n")
				.contains("\"kind\" : \"DECISION\"")
				.contains(DebuggerShell.HELP);
	}
}

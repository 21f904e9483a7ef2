package org.javai.paredros.session;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.paredros.DebuggerException;
import org.javai.paredros.config.DebuggerSettings;
import org.javai.paredros.config.DebuggerSettingsLoader;

/**
 * Command line entry point.
 * <pre>
 * DebuggerMain &lt;grammar.g4&gt; &lt;startRule&gt; &lt;input file&gt; [settings.yml]
 * </pre>
 */
public final class DebuggerMain {

	static final String USAGE = "usage: DebuggerMain <grammar.g4> <startRule> <input file> [settings.yml]";

	private DebuggerMain() {
	}

	public static void main(String[] args) {
		PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		System.exit(run(args, in, out));
	}

	static int run(String[] args, BufferedReader in, PrintWriter out) {
		if (args.length < 3 || args.length > 4) {
			out.println(USAGE);
			return 2;
		}
		DebuggerSettingsLoader loader = new DebuggerSettingsLoader();
		try {
			DebuggerSettings settings = args.length == 4 ? loader.parse(Path.of(args[3])) : loader.load();
			String grammar = Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);
			String input = Files.readString(Path.of(args[2]), StandardCharsets.UTF_8);
			DebugSession session = DebugSession.fromAntlr(grammar, args[1], input, settings);
			new DebuggerShell(session, in, out).run();
			return 0;
		} catch (IOException e) {
			out.println("error: cannot read " + e.getMessage());
			return 1;
		} catch (DebuggerException | IllegalArgumentException e) {
			out.println("error: " + e.getMessage());
			return 1;
		}
	}
}

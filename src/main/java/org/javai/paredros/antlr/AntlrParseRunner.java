package org.javai.paredros.antlr;

import java.util.Objects;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerInterpreter;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.javai.paredros.config.DebuggerSettings;
import org.javai.paredros.event.ParseEventListener;
import org.javai.paredros.event.ParseEventRecorder;
import org.javai.paredros.event.ParseEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an ANTLR grammar over input text and reports the run as parse events.
 */
public class AntlrParseRunner {

	private static final Logger logger = LoggerFactory.getLogger(AntlrParseRunner.class);

	private final DebuggerSettings settings;

	public AntlrParseRunner(DebuggerSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	/**
	 * Lexes and parses {@code input} starting at {@code startRule}, reporting to {@code listener}.
	 * Lexer errors are logged and the run continues; the first syntax error ends it.
	 */
	public void parse(AntlrGrammar grammar, String startRule, String input, ParseEventListener listener) {
		int ruleIndex = grammar.ruleIndex(startRule);
		LexerInterpreter lexer = grammar.createLexer(CharStreams.fromString(input));
		lexer.removeErrorListeners();
		lexer.addErrorListener(new BaseErrorListener() {
			@Override
			public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
					int charPositionInLine, String msg, RecognitionException e) {
				logger.warn("Lexer error at {}:{}: {}", line, charPositionInLine, msg);
			}
		});
		CommonTokenStream tokens = new CommonTokenStream(lexer);
		tokens.fill();

		ParseEventCollector collector = new ParseEventCollector(listener, settings);
		collector.start(tokens.getTokens(), grammar.vocabulary());
		TracingParserInterpreter parser = new TracingParserInterpreter(grammar.fileName(), grammar.vocabulary(),
				grammar.ruleNames(), grammar.atn(), tokens, collector);
		try {
			parser.parse(ruleIndex);
		} catch (ParseCancellationException e) {
			if (!collector.hasError()) {
				collector.syntaxError(null, parser.getState(), "parse cancelled: " + e.getMessage());
			}
			logger.debug("Parse of rule {} stopped at the first error", startRule);
		}
		collector.finish();
	}

	/**
	 * Runs the parse and returns the recorded event stream.
	 */
	public ParseEventStream record(AntlrGrammar grammar, String startRule, String input) {
		ParseEventRecorder recorder = new ParseEventRecorder();
		parse(grammar, startRule, input, recorder);
		return recorder.toStream();
	}
}

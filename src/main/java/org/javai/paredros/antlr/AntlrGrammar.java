package org.javai.paredros.antlr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.antlr.runtime.RecognitionException;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerInterpreter;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.tool.ANTLRMessage;
import org.antlr.v4.tool.ANTLRToolListener;
import org.antlr.v4.tool.Grammar;
import org.antlr.v4.tool.Rule;
import org.javai.paredros.network.TransitionNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A combined ANTLR grammar compiled in memory, together with its transition network.
 */
public final class AntlrGrammar {

	private static final Logger logger = LoggerFactory.getLogger(AntlrGrammar.class);

	private final Grammar grammar;
	private final ATN atn;
	private final TransitionNetwork network;

	private AntlrGrammar(Grammar grammar, ATN atn) {
		this.grammar = grammar;
		this.atn = atn;
		this.network = AntlrNetworkAdapter.adapt(atn, grammar.getVocabulary(), ruleNames());
	}

	/**
	 * Compiles combined grammar text (parser and lexer rules in one grammar).
	 *
	 * @throws GrammarLoadException if the tool reports errors or the grammar has no parser rules
	 */
	public static AntlrGrammar load(String grammarText) {
		Objects.requireNonNull(grammarText, "grammarText");
		CollectingToolListener listener = new CollectingToolListener();
		Grammar grammar;
		try {
			grammar = new Grammar(grammarText, listener);
		} catch (RecognitionException | RuntimeException e) {
			throw new GrammarLoadException("Failed to compile grammar", e);
		}
		if (!listener.errors.isEmpty()) {
			throw new GrammarLoadException("Grammar has errors", listener.errors);
		}
		if (!grammar.isCombined() || grammar.atn == null || grammar.getRuleNames().length == 0) {
			throw new GrammarLoadException("Expected a combined grammar with parser rules", List.of());
		}
		// the interpreter's ATN is a deserialized copy; take the network from the same copy
		ATN atn = grammar.createParserInterpreter(new CommonTokenStream(new ListTokenSource(List.of()))).getATN();
		AntlrGrammar loaded = new AntlrGrammar(grammar, atn);
		logger.debug("Loaded grammar {} with {} rules", loaded.name(), grammar.getRuleNames().length);
		return loaded;
	}

	public String name() {
		return grammar.name != null ? grammar.name : grammar.ast.getGrammarName();
	}

	public String fileName() {
		return grammar.fileName;
	}

	public TransitionNetwork network() {
		return network;
	}

	public ATN atn() {
		return atn;
	}

	public Vocabulary vocabulary() {
		return grammar.getVocabulary();
	}

	public List<String> ruleNames() {
		return Arrays.asList(grammar.getRuleNames());
	}

	public int ruleIndex(String ruleName) {
		Rule rule = grammar.getRule(ruleName);
		if (rule == null) {
			throw new IllegalArgumentException("Grammar " + name() + " has no rule '" + ruleName + "'");
		}
		return rule.index;
	}

	public LexerInterpreter createLexer(CharStream input) {
		return grammar.createLexerInterpreter(input);
	}

	private static final class CollectingToolListener implements ANTLRToolListener {

		private final List<String> errors = new ArrayList<>();

		@Override
		public void info(String msg) {
			logger.debug("ANTLR: {}", msg);
		}

		@Override
		public void error(ANTLRMessage msg) {
			errors.add(describe(msg));
		}

		@Override
		public void warning(ANTLRMessage msg) {
			logger.warn("Grammar warning: {}", describe(msg));
		}

		private static String describe(ANTLRMessage msg) {
			return "line " + msg.line + ":" + msg.charPosition + " " + msg.getErrorType().name()
					+ " " + Arrays.toString(msg.getArgs());
		}
	}
}

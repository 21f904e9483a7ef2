package org.javai.paredros.antlr;

import java.util.Collection;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.InputMismatchException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserInterpreter;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.DecisionState;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parser interpreter that reports every step it takes to a {@link ParseEventCollector}.
 * <p>
 * Predictions at branching decisions are reported with the predicted alternative, or without one
 * when prediction fails. The parse stops at the first syntax error.
 */
class TracingParserInterpreter extends ParserInterpreter {

	private final ParseEventCollector collector;

	TracingParserInterpreter(String grammarFileName, Vocabulary vocabulary, Collection<String> ruleNames, ATN atn,
			TokenStream input, ParseEventCollector collector) {
		super(grammarFileName, vocabulary, ruleNames, atn, input);
		this.collector = collector;
		collector.attach(this);
		setBuildParseTree(false);
		addParseListener(collector);
		setErrorHandler(new FirstErrorStrategy());
		removeErrorListeners();
		addErrorListener(new CollectingErrorListener());
	}

	/**
	 * Another pass through a left-recursive loop reuses the open rule call, so the rule entry
	 * the runtime fires for the new context is not reported.
	 */
	@Override
	public void pushNewRecursionContext(ParserRuleContext localctx, int state, int ruleIndex) {
		collector.suppressRuleEntries(true);
		try {
			super.pushNewRecursionContext(localctx, state, ruleIndex);
		} finally {
			collector.suppressRuleEntries(false);
		}
	}

	@Override
	protected int visitDecisionState(DecisionState p) {
		if (p.getNumberOfTransitions() <= 1) {
			return super.visitDecisionState(p);
		}
		int predicted;
		try {
			predicted = super.visitDecisionState(p);
		} catch (RecognitionException e) {
			collector.decision(p, null);
			throw e;
		}
		collector.decision(p, predicted);
		return predicted;
	}

	/**
	 * Reports errors but never recovers: the first error ends the parse.
	 */
	private static final class FirstErrorStrategy extends DefaultErrorStrategy {

		@Override
		public void recover(Parser recognizer, RecognitionException e) {
			throw new ParseCancellationException(e);
		}

		@Override
		public Token recoverInline(Parser recognizer) {
			throw new InputMismatchException(recognizer);
		}

		@Override
		public void sync(Parser recognizer) {
		}
	}

	private final class CollectingErrorListener extends BaseErrorListener {

		@Override
		public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
				String msg, RecognitionException e) {
			Token offending = offendingSymbol instanceof Token ? (Token) offendingSymbol : null;
			collector.syntaxError(offending, recognizer.getState(), "line " + line + ":" + charPositionInLine + " " + msg);
		}
	}
}

package org.javai.paredros.antlr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.DecisionState;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTreeListener;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.javai.paredros.config.DebuggerSettings;
import org.javai.paredros.event.ParseError;
import org.javai.paredros.event.ParseEvent;
import org.javai.paredros.event.ParseEventListener;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.TransitionNetwork;

/**
 * Translates callbacks of a running ANTLR parser into parse events.
 * <p>
 * Token stream indexes are renumbered densely over the tokens the parser sees. Once the first
 * syntax error is recorded nothing further is forwarded.
 */
class ParseEventCollector implements ParseTreeListener {

	private final ParseEventListener listener;
	private final DebuggerSettings settings;
	private final Map<Integer, Integer> denseIndex = new HashMap<>();
	private final List<TokenInfo> tokens = new ArrayList<>();

	private Parser parser;
	private ParseError error;
	private boolean ruleEntriesSuppressed;

	ParseEventCollector(ParseEventListener listener, DebuggerSettings settings) {
		this.listener = listener;
		this.settings = settings;
	}

	void start(List<? extends Token> streamTokens, Vocabulary vocabulary) {
		for (Token token : streamTokens) {
			if (token.getChannel() != Token.DEFAULT_CHANNEL && token.getType() != Token.EOF) {
				continue;
			}
			int index = tokens.size();
			denseIndex.put(token.getTokenIndex(), index);
			tokens.add(new TokenInfo(index, token.getType(), AntlrNetworkAdapter.tokenName(vocabulary, token.getType()),
					token.getType() == Token.EOF ? "<EOF>" : token.getText()));
			if (token.getType() == Token.EOF) {
				break;
			}
		}
		listener.onParseStart(tokens);
	}

	void attach(Parser runningParser) {
		this.parser = runningParser;
	}

	void suppressRuleEntries(boolean suppressed) {
		this.ruleEntriesSuppressed = suppressed;
	}

	boolean hasError() {
		return error != null;
	}

	void decision(DecisionState state, Integer predictedAlternative) {
		if (hasError()) {
			return;
		}
		List<Integer> targets = new ArrayList<>();
		for (int i = 0; i < state.getNumberOfTransitions(); i++) {
			targets.add(state.transition(i).target.stateNumber);
		}
		Integer reported = settings.reportChosenAlternatives() ? predictedAlternative : null;
		ParseEvent event = ParseEvent.decision(state.ruleIndex, state.stateNumber, currentIndex(), reported)
				.withAvailableAlternatives(targets)
				.withLookahead(lookahead());
		listener.onEvent(event);
	}

	void syntaxError(Token offending, int stateId, String message) {
		if (hasError()) {
			return;
		}
		int index = offending != null ? dense(offending.getTokenIndex()) : currentIndex();
		error = new ParseError(index, stateId, message);
	}

	void finish() {
		if (error != null) {
			listener.onError(error);
		} else {
			listener.onComplete();
		}
	}

	@Override
	public void enterEveryRule(ParserRuleContext ctx) {
		if (hasError() || ruleEntriesSuppressed) {
			return;
		}
		ATN atn = parser.getATN();
		int ruleIndex = ctx.getRuleIndex();
		listener.onEvent(ParseEvent.ruleEnter(ruleIndex, atn.ruleToStartState[ruleIndex].stateNumber, currentIndex(),
				returnState(atn, ctx)));
	}

	@Override
	public void exitEveryRule(ParserRuleContext ctx) {
		if (hasError()) {
			return;
		}
		int ruleIndex = ctx.getRuleIndex();
		listener.onEvent(ParseEvent.ruleExit(ruleIndex, parser.getATN().ruleToStopState[ruleIndex].stateNumber,
				currentIndex()));
	}

	@Override
	public void visitTerminal(TerminalNode node) {
		if (hasError()) {
			return;
		}
		listener.onEvent(ParseEvent.tokenConsume(parser.getContext().getRuleIndex(), parser.getState(),
				dense(node.getSymbol().getTokenIndex())));
	}

	@Override
	public void visitErrorNode(ErrorNode node) {
		// no recovery, so error nodes are never created
	}

	private int returnState(ATN atn, ParserRuleContext ctx) {
		if (ctx.invokingState < 0) {
			return TransitionNetwork.NO_STATE;
		}
		ATNState invoking = atn.states.get(ctx.invokingState);
		if (invoking.getNumberOfTransitions() > 0 && invoking.transition(0) instanceof RuleTransition) {
			return ((RuleTransition) invoking.transition(0)).followState.stateNumber;
		}
		return TransitionNetwork.NO_STATE;
	}

	private int currentIndex() {
		return dense(parser.getInputStream().LT(1).getTokenIndex());
	}

	private List<TokenInfo> lookahead() {
		TokenStream input = parser.getInputStream();
		List<TokenInfo> result = new ArrayList<>();
		for (int i = 1; i <= settings.lookaheadDepth(); i++) {
			Token token = input.LT(i);
			result.add(tokens.get(dense(token.getTokenIndex())));
			if (token.getType() == Token.EOF) {
				break;
			}
		}
		return result;
	}

	private int dense(int streamIndex) {
		Integer index = denseIndex.get(streamIndex);
		return index != null ? index : tokens.size() - 1;
	}
}

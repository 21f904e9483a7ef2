package org.javai.paredros.testsupport;

import static org.javai.paredros.network.StateKind.BASIC;
import static org.javai.paredros.network.StateKind.DECISION;
import static org.javai.paredros.network.StateKind.TOKEN_MATCH;

import java.util.ArrayList;
import java.util.List;
import org.javai.paredros.event.ParseError;
import org.javai.paredros.event.ParseEvent;
import org.javai.paredros.event.ParseEventStream;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.TransitionNetwork;

/**
 * Hand-built networks and event streams for tests that run without a parsing engine.
 * <p>
 * The Simpleton network reproduces the compiled form of
 * <pre>
 * startRule : EINS+ | zwoelf | DREI DREI | EINS ZWEI DREI ;
 * zwoelf : EINS (ZWEI | DREI)+ ;
 * </pre>
 * with the state numbers ANTLR assigns. The nested network reproduces
 * {@code nested : LP nested RP | X ;}.
 */
public final class SimpletonFixtures {

	public static final int EINS = 1;
	public static final int ZWEI = 2;
	public static final int DREI = 3;

	public static final int START_RULE = 0;
	public static final int ZWOELF = 1;

	public static final int ROOT_DECISION = 15;
	public static final int START_LOOP = 7;
	public static final int ZWOELF_LOOP = 21;

	public static final int LP = 1;
	public static final int RP = 2;
	public static final int X = 3;
	public static final int NESTED = 0;
	public static final int NESTED_DECISION = 2;

	private SimpletonFixtures() {
	}

	public static TransitionNetwork simpleton() {
		return TransitionNetwork.builder()
				.tokenName(EINS, "EINS")
				.tokenName(ZWEI, "ZWEI")
				.tokenName(DREI, "DREI")
				.rule(START_RULE, "startRule", 0, 1)
				.rule(ZWOELF, "zwoelf", 2, 3)
				.state(4, START_RULE, TOKEN_MATCH)
				.state(5, START_RULE, BASIC)
				.state(6, START_RULE, BASIC)
				.state(7, START_RULE, DECISION)
				.state(8, START_RULE, BASIC)
				.state(9, START_RULE, BASIC)
				.state(10, START_RULE, TOKEN_MATCH)
				.state(11, START_RULE, TOKEN_MATCH)
				.state(12, START_RULE, TOKEN_MATCH)
				.state(13, START_RULE, TOKEN_MATCH)
				.state(14, START_RULE, TOKEN_MATCH)
				.state(15, START_RULE, DECISION)
				.state(16, START_RULE, BASIC)
				.state(17, ZWOELF, TOKEN_MATCH)
				.state(18, ZWOELF, TOKEN_MATCH)
				.state(19, ZWOELF, BASIC)
				.state(20, ZWOELF, BASIC)
				.state(21, ZWOELF, DECISION)
				.state(22, ZWOELF, BASIC)
				.state(23, ZWOELF, BASIC)
				.epsilon(0, 15)
				.epsilon(2, 17)
				.token(4, 6, EINS)
				.epsilon(5, 4)
				.epsilon(6, 7)
				.epsilon(7, 5)
				.epsilon(7, 8)
				.epsilon(8, 16)
				.ruleCall(9, ZWOELF, 16)
				.token(10, 11, DREI)
				.token(11, 16, DREI)
				.token(12, 13, EINS)
				.token(13, 14, ZWEI)
				.token(14, 16, DREI)
				.epsilon(15, 5)
				.epsilon(15, 9)
				.epsilon(15, 10)
				.epsilon(15, 12)
				.epsilon(16, 1)
				.token(17, 19, EINS)
				.token(18, 20, ZWEI, DREI)
				.epsilon(19, 18)
				.epsilon(20, 21)
				.epsilon(21, 19)
				.epsilon(21, 22)
				.epsilon(22, 3)
				.build();
	}

	public static TransitionNetwork nested() {
		return TransitionNetwork.builder()
				.tokenName(LP, "LP")
				.tokenName(RP, "RP")
				.tokenName(X, "X")
				.rule(NESTED, "nested", 0, 1)
				.state(2, NESTED, DECISION)
				.state(3, NESTED, TOKEN_MATCH)
				.state(4, NESTED, BASIC)
				.state(5, NESTED, TOKEN_MATCH)
				.state(6, NESTED, BASIC)
				.state(7, NESTED, TOKEN_MATCH)
				.epsilon(0, 2)
				.epsilon(2, 3)
				.epsilon(2, 7)
				.token(3, 4, LP)
				.ruleCall(4, NESTED, 5)
				.token(5, 6, RP)
				.epsilon(6, 1)
				.token(7, 6, X)
				.build();
	}

	/**
	 * A network whose first alternative runs into an epsilon cycle.
	 */
	public static TransitionNetwork epsilonCycle() {
		return TransitionNetwork.builder()
				.rule(0, "spin", 0, 1)
				.state(2, 0, BASIC)
				.state(3, 0, DECISION)
				.state(5, 0, BASIC)
				.epsilon(0, 3)
				.epsilon(3, 2)
				.epsilon(3, 1)
				.epsilon(2, 5)
				.epsilon(5, 2)
				.build();
	}

	/**
	 * Tokens of a Simpleton input made of the digits 1, 2 and 3, followed by EOF.
	 */
	public static List<TokenInfo> simpletonTokens(String digits) {
		List<TokenInfo> tokens = new ArrayList<>();
		for (char digit : digits.toCharArray()) {
			int type = digit - '0';
			String name = switch (type) {
				case EINS -> "EINS";
				case ZWEI -> "ZWEI";
				case DREI -> "DREI";
				default -> throw new IllegalArgumentException("Not a Simpleton token: " + digit);
			};
			tokens.add(new TokenInfo(tokens.size(), type, name, String.valueOf(digit)));
		}
		tokens.add(TokenInfo.eof(tokens.size()));
		return tokens;
	}

	public static List<TokenInfo> nestedTokens(String input) {
		List<TokenInfo> tokens = new ArrayList<>();
		for (char c : input.toCharArray()) {
			TokenInfo token = switch (c) {
				case '(' -> new TokenInfo(tokens.size(), LP, "LP", "(");
				case ')' -> new TokenInfo(tokens.size(), RP, "RP", ")");
				case 'x' -> new TokenInfo(tokens.size(), X, "X", "x");
				default -> throw new IllegalArgumentException("Not a nested token: " + c);
			};
			tokens.add(token);
		}
		tokens.add(TokenInfo.eof(tokens.size()));
		return tokens;
	}

	/**
	 * "123": the root decision without a reported choice, then three consumed tokens.
	 */
	public static ParseEventStream oneTwoThree() {
		return ParseEventStream.accepted(simpletonTokens("123"), List.of(
				ParseEvent.decision(START_RULE, ROOT_DECISION, 0, null),
				ParseEvent.tokenConsume(START_RULE, 12, 0),
				ParseEvent.tokenConsume(START_RULE, 13, 1),
				ParseEvent.tokenConsume(START_RULE, 14, 2)));
	}

	/**
	 * "111": the root decision without a reported choice, then three EINS matched by the loop.
	 */
	public static ParseEventStream oneOneOne() {
		return ParseEventStream.accepted(simpletonTokens("111"), List.of(
				ParseEvent.decision(START_RULE, ROOT_DECISION, 0, null),
				ParseEvent.tokenConsume(START_RULE, 4, 0),
				ParseEvent.tokenConsume(START_RULE, 4, 1),
				ParseEvent.tokenConsume(START_RULE, 4, 2)));
	}

	/**
	 * "111" as a tracing engine reports it: rule events and every loop decision with its choice.
	 */
	public static ParseEventStream oneOneOneTraced() {
		return ParseEventStream.accepted(simpletonTokens("111"), List.of(
				ParseEvent.ruleEnter(START_RULE, 0, 0),
				ParseEvent.decision(START_RULE, ROOT_DECISION, 0, 1),
				ParseEvent.tokenConsume(START_RULE, 4, 0),
				ParseEvent.decision(START_RULE, START_LOOP, 1, 1),
				ParseEvent.tokenConsume(START_RULE, 4, 1),
				ParseEvent.decision(START_RULE, START_LOOP, 2, 1),
				ParseEvent.tokenConsume(START_RULE, 4, 2),
				ParseEvent.decision(START_RULE, START_LOOP, 3, 2),
				ParseEvent.ruleExit(START_RULE, 1, 3)));
	}

	/**
	 * "4": the lexer produced nothing usable and the root decision fails.
	 */
	public static ParseEventStream unknownDigit() {
		return ParseEventStream.rejected(List.of(TokenInfo.eof(0)), List.of(
				ParseEvent.decision(START_RULE, ROOT_DECISION, 0, null)),
				new ParseError(0, ROOT_DECISION, "no viable alternative at input '4'"));
	}

	/**
	 * "((x))" with rule events and reported choices.
	 */
	public static ParseEventStream nestedTwice(boolean reportChoices) {
		Integer descend = reportChoices ? 1 : null;
		Integer bottom = reportChoices ? 2 : null;
		return ParseEventStream.accepted(nestedTokens("((x))"), List.of(
				ParseEvent.ruleEnter(NESTED, 0, 0),
				ParseEvent.decision(NESTED, NESTED_DECISION, 0, descend),
				ParseEvent.tokenConsume(NESTED, 3, 0),
				ParseEvent.ruleEnter(NESTED, 0, 1, 5),
				ParseEvent.decision(NESTED, NESTED_DECISION, 1, descend),
				ParseEvent.tokenConsume(NESTED, 3, 1),
				ParseEvent.ruleEnter(NESTED, 0, 2, 5),
				ParseEvent.decision(NESTED, NESTED_DECISION, 2, bottom),
				ParseEvent.tokenConsume(NESTED, 7, 2),
				ParseEvent.ruleExit(NESTED, 1, 3),
				ParseEvent.tokenConsume(NESTED, 5, 3),
				ParseEvent.ruleExit(NESTED, 1, 4),
				ParseEvent.tokenConsume(NESTED, 5, 4),
				ParseEvent.ruleExit(NESTED, 1, 5)));
	}
}

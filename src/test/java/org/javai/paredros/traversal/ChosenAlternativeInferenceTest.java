package org.javai.paredros.traversal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.paredros.testsupport.SimpletonFixtures.ROOT_DECISION;
import static org.javai.paredros.testsupport.SimpletonFixtures.START_RULE;
import static org.javai.paredros.testsupport.SimpletonFixtures.ZWOELF;
import static org.javai.paredros.testsupport.SimpletonFixtures.simpletonTokens;

import java.util.List;
import org.javai.paredros.event.ParseEvent;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.CallFrame;
import org.javai.paredros.network.TransitionNetwork;
import org.javai.paredros.testsupport.SimpletonFixtures;
import org.junit.jupiter.api.Test;

class ChosenAlternativeInferenceTest {

	private final TransitionNetwork network = SimpletonFixtures.simpleton();
	private final ChosenAlternativeInference inference = new ChosenAlternativeInference(network, 100_000, 256);
	private final List<Alternative> rootAlternatives = Alternatives.forDecision(network, ROOT_DECISION, List.of());

	@Test
	void picksTheOnlyAlternativeThatReproducesTheTokens() {
		List<TokenInfo> tokens = simpletonTokens("123");
		List<ParseEvent> suffix = List.of(
				ParseEvent.tokenConsume(START_RULE, 12, 0),
				ParseEvent.tokenConsume(START_RULE, 13, 1),
				ParseEvent.tokenConsume(START_RULE, 14, 2));

		assertThat(inference.infer(rootAlternatives, suffix, List.of(), tokens, true)).hasValue(4);
	}

	@Test
	void ruleCallsMustBeObserved() {
		List<TokenInfo> tokens = simpletonTokens("123");
		List<ParseEvent> suffix = List.of(
				ParseEvent.ruleEnter(ZWOELF, 2, 0, 16),
				ParseEvent.tokenConsume(ZWOELF, 17, 0),
				ParseEvent.tokenConsume(ZWOELF, 18, 1),
				ParseEvent.tokenConsume(ZWOELF, 18, 2),
				ParseEvent.ruleExit(ZWOELF, 3, 3));

		assertThat(inference.infer(rootAlternatives, suffix, List.of(), tokens, true)).hasValue(2);
	}

	@Test
	void acceptedRunMustEndAfterTheSuffix() {
		List<TokenInfo> tokens = simpletonTokens("11");
		List<ParseEvent> suffix = List.of(
				ParseEvent.tokenConsume(START_RULE, 4, 0),
				ParseEvent.tokenConsume(START_RULE, 4, 1));

		assertThat(inference.infer(rootAlternatives, suffix, List.of(), tokens, true)).hasValue(1);
	}

	@Test
	void rejectedRunOnlyNeedsToMatchWhatWasObserved() {
		List<TokenInfo> tokens = simpletonTokens("12");
		List<ParseEvent> suffix = List.of(
				ParseEvent.tokenConsume(START_RULE, 12, 0),
				ParseEvent.tokenConsume(START_RULE, 13, 1));

		assertThat(inference.infer(rootAlternatives, suffix, List.of(), tokens, false)).hasValue(4);
	}

	@Test
	void rejectedRunWithoutObservationsStaysUnknown() {
		assertThat(inference.infer(rootAlternatives, List.of(), List.of(), simpletonTokens(""), false)).isEmpty();
	}

	@Test
	void decisionEventsAreNotObservations() {
		List<TokenInfo> tokens = simpletonTokens("123");
		List<ParseEvent> suffix = List.of(
				ParseEvent.decision(START_RULE, ROOT_DECISION, 0, 4),
				ParseEvent.tokenConsume(START_RULE, 12, 0),
				ParseEvent.tokenConsume(START_RULE, 13, 1),
				ParseEvent.tokenConsume(START_RULE, 14, 2));

		assertThat(inference.infer(rootAlternatives, suffix, List.of(), tokens, true)).hasValue(4);
	}

	@Test
	void noConsistentAlternativeStaysUnknown() {
		List<TokenInfo> tokens = simpletonTokens("2");
		List<ParseEvent> suffix = List.of(ParseEvent.tokenConsume(START_RULE, 4, 0));

		assertThat(inference.infer(rootAlternatives, suffix, List.of(), tokens, true)).isEmpty();
	}

	@Test
	void resumesCallersThroughTheirReturnStates() {
		TransitionNetwork nested = SimpletonFixtures.nested();
		ChosenAlternativeInference nestedInference = new ChosenAlternativeInference(nested, 100_000, 256);
		List<Alternative> alternatives = Alternatives.forDecision(nested, SimpletonFixtures.NESTED_DECISION, List.of());
		List<CallFrame> stack = List.of(
				new CallFrame(0, TransitionNetwork.NO_STATE), new CallFrame(0, 5), new CallFrame(0, 5));
		List<ParseEvent> suffix = List.of(
				ParseEvent.tokenConsume(0, 7, 2),
				ParseEvent.ruleExit(0, 1, 3),
				ParseEvent.tokenConsume(0, 5, 3),
				ParseEvent.ruleExit(0, 1, 4),
				ParseEvent.tokenConsume(0, 5, 4),
				ParseEvent.ruleExit(0, 1, 5));

		assertThat(nestedInference.infer(alternatives, suffix, stack, SimpletonFixtures.nestedTokens("((x))"), true))
				.hasValue(2);
	}

	@Test
	void givesUpWhenTheBudgetRunsOut() {
		ChosenAlternativeInference starved = new ChosenAlternativeInference(network, 1, 256);
		List<ParseEvent> suffix = List.of(
				ParseEvent.tokenConsume(START_RULE, 12, 0),
				ParseEvent.tokenConsume(START_RULE, 13, 1),
				ParseEvent.tokenConsume(START_RULE, 14, 2));

		assertThat(starved.infer(rootAlternatives, suffix, List.of(), simpletonTokens("123"), true)).isEmpty();
	}
}

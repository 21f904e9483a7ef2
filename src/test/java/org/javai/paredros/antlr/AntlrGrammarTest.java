package org.javai.paredros.antlr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.paredros.network.StateKind;
import org.javai.paredros.network.TransitionNetwork;
import org.javai.paredros.testsupport.GrammarFixtures;
import org.junit.jupiter.api.Test;

class AntlrGrammarTest {

	@Test
	void compilesACombinedGrammar() {
		AntlrGrammar grammar = AntlrGrammar.load(GrammarFixtures.simpleton());

		assertThat(grammar.name()).isEqualTo("Simpleton");
		assertThat(grammar.ruleNames()).containsExactly("startRule", "zwoelf");
		assertThat(grammar.ruleIndex("zwoelf")).isEqualTo(1);
		assertThat(grammar.vocabulary().getSymbolicName(1)).isEqualTo("EINS");
	}

	@Test
	void networkMirrorsTheGrammar() {
		TransitionNetwork network = AntlrGrammar.load(GrammarFixtures.simpleton()).network();

		assertThat(network.ruleCount()).isEqualTo(2);
		assertThat(network.ruleId("startRule")).hasValue(0);
		assertThat(network.tokenName(1)).isEqualTo("EINS");
		assertThat(network.tokenName(3)).isEqualTo("DREI");
		int start = network.ruleStartState(0);
		assertThat(network.state(start)).get()
				.satisfies(state -> assertThat(state.kind()).isEqualTo(StateKind.RULE_START));
		assertThat(network.state(network.ruleStopState(1))).get()
				.satisfies(state -> assertThat(state.isRuleStop()).isTrue());
	}

	@Test
	void firstDecisionOffersEveryAlternative() {
		TransitionNetwork network = AntlrGrammar.load(GrammarFixtures.simpleton()).network();

		int decision = network.transitionsFrom(network.ruleStartState(0)).get(0).to();

		assertThat(network.isBranching(decision)).isTrue();
		assertThat(network.transitionsFrom(decision)).hasSize(4);
	}

	@Test
	void unknownRuleIsRefused() {
		AntlrGrammar grammar = AntlrGrammar.load(GrammarFixtures.nested());

		assertThatThrownBy(() -> grammar.ruleIndex("expression"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Grammar Nested has no rule 'expression'");
	}

	@Test
	void reportsSemanticErrors() {
		assertThatThrownBy(() -> AntlrGrammar.load("grammar Broken;\nr : missing ;\n"))
				.isInstanceOf(GrammarLoadException.class)
				.satisfies(e -> assertThat(((GrammarLoadException) e).problems()).isNotEmpty());
	}

	@Test
	void reportsSyntaxErrors() {
		assertThatThrownBy(() -> AntlrGrammar.load("grammar ;;; nonsense"))
				.isInstanceOf(GrammarLoadException.class);
	}

	@Test
	void refusesLexerOnlyGrammars() {
		assertThatThrownBy(() -> AntlrGrammar.load("lexer grammar Digits;\nD : [0-9] ;\n"))
				.isInstanceOf(GrammarLoadException.class);
	}
}

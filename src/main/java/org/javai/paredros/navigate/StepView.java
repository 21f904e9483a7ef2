package org.javai.paredros.navigate;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.network.CallFrame;
import org.javai.paredros.traversal.Alternative;
import org.javai.paredros.traversal.NodeKind;
import org.javai.paredros.traversal.TraversalGraph;
import org.javai.paredros.traversal.TraversalNode;

/**
 * Read-only snapshot of one step, as shown to the user.
 */
public record StepView(
		int stepId,
		NodeKind kind,
		NavigatorState state,
		int stateId,
		String ruleName,
		List<String> callStack,
		int inputPosition,
		TokenInfo nextToken,
		List<TokenInfo> lookahead,
		List<AlternativeView> alternatives,
		List<TokenInfo> consumed,
		List<TokenInfo> remaining,
		boolean synthetic,
		String detail
) {

	public static final String INPUT_CURSOR = "⏺";

	public StepView {
		callStack = List.copyOf(callStack);
		lookahead = List.copyOf(lookahead);
		alternatives = List.copyOf(alternatives);
		consumed = List.copyOf(consumed);
		remaining = List.copyOf(remaining);
	}

	public static StepView of(TraversalGraph graph, TraversalNode node) {
		Integer chosen = node.chosenAlternative().orElse(null);
		List<AlternativeView> alternatives = node.alternatives().stream()
				.map(alternative -> AlternativeView.of(alternative, chosen))
				.toList();
		List<String> callStack = node.callStack().stream()
				.map(CallFrame::ruleId)
				.map(graph.network()::ruleName)
				.toList();
		return new StepView(
				node.id(),
				node.kind(),
				NavigatorState.of(node),
				node.stateId(),
				node.ruleName(),
				callStack,
				node.inputPosition(),
				graph.tokenAt(node.inputPosition()),
				node.lookahead(),
				alternatives,
				graph.consumedTokens(node.inputPosition()),
				graph.remainingTokens(node.inputPosition()),
				node.isSynthetic(),
				node.detail().orElse(null));
	}

	public Optional<AlternativeView> chosenAlternative() {
		return alternatives.stream().filter(AlternativeView::chosen).findFirst();
	}

	/**
	 * The input text with a cursor between consumed and remaining tokens.
	 */
	public String inputWithCursor() {
		String before = consumed.stream()
				.filter(token -> !token.isEof())
				.map(TokenInfo::text)
				.collect(Collectors.joining(" "));
		String after = remaining.stream()
				.map(TokenInfo::text)
				.collect(Collectors.joining(" "));
		return (before + " " + INPUT_CURSOR + " " + after).trim();
	}

	public record AlternativeView(int index, String label, int targetStateId, boolean chosen, boolean expanded) {

		static AlternativeView of(Alternative alternative, Integer chosenIndex) {
			boolean chosen = chosenIndex != null && chosenIndex == alternative.index();
			return new AlternativeView(alternative.index(), alternative.label(), alternative.targetStateId(), chosen,
					alternative.isExpanded());
		}
	}
}

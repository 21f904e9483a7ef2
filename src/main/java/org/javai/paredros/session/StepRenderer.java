package org.javai.paredros.session;

import java.util.stream.Collectors;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.navigate.StepView;

/**
 * Plain text rendering of a step for the shell.
 */
public final class StepRenderer {

	private StepRenderer() {
	}

	public static String render(StepView view) {
		StringBuilder sb = new StringBuilder();
		sb.append(view.synthetic() ? "↳" : "●")
				.append(" [step ").append(view.stepId()).append("] ")
				.append(view.kind())
				.append(" (").append(view.state()).append(")\n");
		sb.append("  rule: ").append(view.ruleName().isEmpty() ? "-" : view.ruleName())
				.append(", state ").append(view.stateId()).append('\n');
		if (!view.callStack().isEmpty()) {
			sb.append("  call stack: ").append(String.join(" > ", view.callStack())).append('\n');
		}
		sb.append("  next token: ").append(view.nextToken()).append('\n');
		sb.append("  lookahead: ").append(view.lookahead().stream()
				.map(TokenInfo::toString)
				.collect(Collectors.joining(" "))).append('\n');
		if (!view.alternatives().isEmpty()) {
			sb.append("  alternatives:\n");
			for (StepView.AlternativeView alternative : view.alternatives()) {
				sb.append(alternative.chosen() ? "  * " : "    ")
						.append(alternative.index()).append(": ").append(alternative.label());
				if (alternative.expanded()) {
					sb.append(" (explored)");
				}
				sb.append('\n');
			}
			if (view.chosenAlternative().isEmpty()) {
				sb.append("  chosen: unknown\n");
			}
		}
		sb.append("  input: ").append(view.inputWithCursor()).append('\n');
		if (view.detail() != null) {
			sb.append("  detail: ").append(view.detail()).append('\n');
		}
		return sb.toString();
	}
}

package org.javai.paredros.session;

import java.util.List;
import java.util.Objects;
import org.javai.paredros.antlr.AntlrGrammar;
import org.javai.paredros.antlr.AntlrParseRunner;
import org.javai.paredros.config.DebuggerSettings;
import org.javai.paredros.event.ParseEventStream;
import org.javai.paredros.navigate.Navigator;
import org.javai.paredros.network.TransitionNetwork;
import org.javai.paredros.trace.RuleTreeBuilder;
import org.javai.paredros.trace.RuleTreeNode;
import org.javai.paredros.traversal.AlternativeExpander;
import org.javai.paredros.traversal.TraversalGraph;
import org.javai.paredros.traversal.TraversalGraphBuilder;

/**
 * One debugging session: a built traversal graph and the navigator over it.
 * <p>
 * Construction failures propagate before a session exists, so a session always holds a complete
 * graph.
 */
public final class DebugSession {

	private final TraversalGraph graph;
	private final Navigator navigator;
	private final DebuggerSettings settings;

	private DebugSession(TraversalGraph graph, DebuggerSettings settings) {
		this.graph = graph;
		this.settings = settings;
		this.navigator = new Navigator(graph, new AlternativeExpander(settings));
	}

	public static DebugSession open(TransitionNetwork network, ParseEventStream stream, DebuggerSettings settings) {
		Objects.requireNonNull(settings, "settings");
		return new DebugSession(TraversalGraphBuilder.build(network, stream, settings), settings);
	}

	public static DebugSession fromAntlr(String grammarText, String startRule, String input,
			DebuggerSettings settings) {
		return fromAntlr(AntlrGrammar.load(grammarText), startRule, input, settings);
	}

	/**
	 * Parses {@code input} with the grammar, building the graph while the parser runs.
	 */
	public static DebugSession fromAntlr(AntlrGrammar grammar, String startRule, String input,
			DebuggerSettings settings) {
		TraversalGraphBuilder builder = new TraversalGraphBuilder(grammar.network(), settings);
		new AntlrParseRunner(settings).parse(grammar, startRule, input, builder);
		return new DebugSession(builder.graph(), settings);
	}

	public TraversalGraph graph() {
		return graph;
	}

	public Navigator navigator() {
		return navigator;
	}

	public DebuggerSettings settings() {
		return settings;
	}

	public List<RuleTreeNode> ruleTree() {
		return RuleTreeBuilder.build(graph);
	}
}

package org.javai.paredros.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.paredros.DebuggerException;
import org.javai.paredros.event.TokenInfo;
import org.javai.paredros.navigate.StepView;

/**
 * Utility to convert rule trees and step views into JSON for export or diagnostics.
 */
public final class TraceJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private TraceJsonMapper() {
	}

	public static ObjectNode toJson(RuleTreeNode tree) {
		ObjectNode node = mapper.createObjectNode();
		node.put("id", tree.id());
		if (tree.kind() == RuleTreeNode.Kind.TOKEN) {
			node.put("type", "token");
			node.put("token", tree.tokenType());
			node.put("text", tree.tokenText());
			return node;
		}
		node.put("type", "rule");
		node.put("rule", tree.ruleName());
		if (!tree.traceSteps().isEmpty()) {
			ArrayNode steps = node.putArray("steps");
			tree.traceSteps().forEach(steps::add);
		}
		ArrayNode children = node.putArray("children");
		for (RuleTreeNode child : tree.children()) {
			children.add(toJson(child));
		}
		return node;
	}

	public static ArrayNode toJsonArray(List<RuleTreeNode> trees) {
		ArrayNode array = mapper.createArrayNode();
		for (RuleTreeNode tree : trees) {
			array.add(toJson(tree));
		}
		return array;
	}

	public static ObjectNode toJson(StepView view) {
		ObjectNode node = mapper.createObjectNode();
		node.put("step", view.stepId());
		node.put("kind", view.kind().name());
		node.put("state", view.state().name());
		node.put("networkState", view.stateId());
		node.put("rule", view.ruleName());
		node.put("synthetic", view.synthetic());
		ArrayNode callStack = node.putArray("callStack");
		view.callStack().forEach(callStack::add);
		node.put("inputPosition", view.inputPosition());
		node.set("nextToken", toJson(view.nextToken()));
		ArrayNode lookahead = node.putArray("lookahead");
		view.lookahead().forEach(token -> lookahead.add(toJson(token)));
		if (!view.alternatives().isEmpty()) {
			ArrayNode alternatives = node.putArray("alternatives");
			for (StepView.AlternativeView alternative : view.alternatives()) {
				ObjectNode aNode = alternatives.addObject();
				aNode.put("index", alternative.index());
				aNode.put("label", alternative.label());
				aNode.put("targetState", alternative.targetStateId());
				aNode.put("chosen", alternative.chosen());
				aNode.put("expanded", alternative.expanded());
			}
		}
		node.put("input", view.inputWithCursor());
		if (view.detail() != null) {
			node.put("detail", view.detail());
		}
		return node;
	}

	public static String writePretty(JsonNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
		} catch (JsonProcessingException e) {
			throw new DebuggerException("Failed to render JSON", e);
		}
	}

	private static ObjectNode toJson(TokenInfo token) {
		ObjectNode node = mapper.createObjectNode();
		node.put("index", token.index());
		node.put("type", token.typeName());
		node.put("text", token.text());
		return node;
	}
}

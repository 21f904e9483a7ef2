package org.javai.paredros.event;

import java.util.List;

/**
 * Contract between a parsing engine and the debugger.
 * <p>
 * An engine calls {@link #onParseStart(List)} once with every token it will see, then reports
 * steps in order through {@link #onEvent(ParseEvent)}. A run ends with exactly one of
 * {@link #onError(ParseError)} (first failure, nothing is reported afterwards) or
 * {@link #onComplete()}.
 */
public interface ParseEventListener {

	void onParseStart(List<TokenInfo> tokens);

	void onEvent(ParseEvent event);

	void onError(ParseError error);

	void onComplete();
}

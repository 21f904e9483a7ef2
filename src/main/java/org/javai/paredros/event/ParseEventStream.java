package org.javai.paredros.event;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A recorded parse run that can be replayed into any {@link ParseEventListener}.
 */
public record ParseEventStream(List<TokenInfo> tokens, List<ParseEvent> events, ParseError error) {

	public ParseEventStream {
		tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
		events = List.copyOf(Objects.requireNonNull(events, "events"));
	}

	public static ParseEventStream accepted(List<TokenInfo> tokens, List<ParseEvent> events) {
		return new ParseEventStream(tokens, events, null);
	}

	public static ParseEventStream rejected(List<TokenInfo> tokens, List<ParseEvent> events, ParseError error) {
		return new ParseEventStream(tokens, events, Objects.requireNonNull(error, "error"));
	}

	public boolean isRejected() {
		return error != null;
	}

	public Optional<ParseError> rejection() {
		return Optional.ofNullable(error);
	}

	public void replay(ParseEventListener listener) {
		listener.onParseStart(tokens);
		for (ParseEvent event : events) {
			listener.onEvent(event);
		}
		if (error != null) {
			listener.onError(error);
		} else {
			listener.onComplete();
		}
	}
}

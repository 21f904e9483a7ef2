package org.javai.paredros.event;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures a live run so it can be replayed later.
 */
public class ParseEventRecorder implements ParseEventListener {

	private final List<TokenInfo> tokens = new ArrayList<>();
	private final List<ParseEvent> events = new ArrayList<>();
	private ParseError error;
	private boolean finished;

	@Override
	public void onParseStart(List<TokenInfo> startTokens) {
		requireOpen();
		tokens.clear();
		tokens.addAll(startTokens);
	}

	@Override
	public void onEvent(ParseEvent event) {
		requireOpen();
		events.add(event);
	}

	@Override
	public void onError(ParseError parseError) {
		requireOpen();
		this.error = parseError;
		this.finished = true;
	}

	@Override
	public void onComplete() {
		requireOpen();
		this.finished = true;
	}

	public boolean isFinished() {
		return finished;
	}

	public ParseEventStream toStream() {
		if (!finished) {
			throw new IllegalStateException("Recording has not finished");
		}
		return error != null
				? ParseEventStream.rejected(tokens, events, error)
				: ParseEventStream.accepted(tokens, events);
	}

	private void requireOpen() {
		if (finished) {
			throw new IllegalStateException("Recording already finished; no further events accepted");
		}
	}
}

package org.javai.paredros.event;

import java.util.Objects;

/**
 * A token as the parser sees it. Indexes are dense over the tokens the parser consumes; tokens on
 * hidden channels are not numbered. The end of input is a token of type {@link #EOF_TYPE}.
 */
public record TokenInfo(int index, int type, String typeName, String text) {

	public static final int EOF_TYPE = -1;

	public TokenInfo {
		if (index < 0) {
			throw new IllegalArgumentException("Token index must not be negative: " + index);
		}
		Objects.requireNonNull(typeName, "typeName");
		text = text != null ? text : "";
	}

	public static TokenInfo eof(int index) {
		return new TokenInfo(index, EOF_TYPE, "EOF", "<EOF>");
	}

	public boolean isEof() {
		return type == EOF_TYPE;
	}

	@Override
	public String toString() {
		return isEof() ? "EOF" : typeName + " ('" + text + "')";
	}
}

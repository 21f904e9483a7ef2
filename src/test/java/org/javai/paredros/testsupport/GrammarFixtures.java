package org.javai.paredros.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Grammar sources kept under {@code grammars/} on the test classpath.
 */
public final class GrammarFixtures {

	private GrammarFixtures() {
	}

	public static String simpleton() {
		return read("grammars/Simpleton.g4");
	}

	public static String nested() {
		return read("grammars/Nested.g4");
	}

	public static String expr() {
		return read("grammars/Expr.g4");
	}

	private static String read(String resource) {
		try (InputStream stream = GrammarFixtures.class.getClassLoader().getResourceAsStream(resource)) {
			if (stream == null) {
				throw new IllegalStateException("Missing test resource " + resource);
			}
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}

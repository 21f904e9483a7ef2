package org.javai.paredros.traversal;

public enum TerminalStatus {
	NONE,
	ACCEPTED,
	REJECTED
}

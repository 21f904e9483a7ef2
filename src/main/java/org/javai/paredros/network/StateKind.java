package org.javai.paredros.network;

public enum StateKind {
	RULE_START,
	RULE_STOP,
	DECISION,
	BASIC,
	TOKEN_MATCH
}

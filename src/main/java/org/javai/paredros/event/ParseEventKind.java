package org.javai.paredros.event;

public enum ParseEventKind {
	RULE_ENTER,
	RULE_EXIT,
	TOKEN_CONSUME,
	DECISION_ENTER
}

package org.javai.paredros.navigate;

/**
 * Outcome of a cursor move.
 */
public enum MoveResult {
	MOVED,
	AT_ROOT,
	AT_TERMINAL,
	AWAITING_SELECTION
}

package org.javai.paredros.traversal;

import java.util.ArrayList;
import java.util.List;
import org.javai.paredros.network.Transition;
import org.javai.paredros.network.TransitionNetwork;

/**
 * Creates the alternative slots of a decision step.
 */
final class Alternatives {

	private Alternatives() {
	}

	/**
	 * Alternatives for a decision at {@code stateId}. When the engine names the target states they
	 * define the order; otherwise the network's transition order applies.
	 */
	static List<Alternative> forDecision(TransitionNetwork network, int stateId, List<Integer> reportedTargets) {
		List<Alternative> alternatives = new ArrayList<>();
		if (reportedTargets.isEmpty()) {
			for (Transition transition : network.transitionsFrom(stateId)) {
				alternatives.add(create(network, alternatives.size() + 1, transition));
			}
		} else {
			for (Integer target : reportedTargets) {
				if (network.state(target).isEmpty()) {
					throw new ConstructionException("Decision at state " + stateId
							+ " names unknown alternative target state " + target);
				}
				alternatives.add(create(network, alternatives.size() + 1, network.entryTransition(stateId, target)));
			}
		}
		return alternatives;
	}

	private static Alternative create(TransitionNetwork network, int index, Transition entry) {
		return new Alternative(index, entry, network.describePath(entry));
	}
}

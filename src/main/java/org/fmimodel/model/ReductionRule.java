package org.fmimodel.model;

import org.fmimodel.vocab.ElementKind;

/** Folds the children of an element that was just closed into the element's node on a {@link NodeStack} */
@FunctionalInterface
public interface ReductionRule {
	/**
	 * @param closed The kind of the element that was closed
	 * @return The kind of node that must be at the top of the stack after the reduction. This is normally the closed kind itself.
	 * @throws ModelDescriptionException If the stack does not hold the children expected for the element
	 */
	ElementKind reduce(ElementKind closed) throws ModelDescriptionException;
}

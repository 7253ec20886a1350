package org.fmimodel.model;

/** The outcome of reading a typed attribute value from a {@link ModelElement} */
public enum ValueStatus {
	/** The attribute was specified and its text could be interpreted as the requested type */
	DEFINED,
	/** The attribute was not specified */
	MISSING,
	/** The attribute was specified but its text could not be interpreted as the requested type */
	ILLEGAL;
}

package org.fmimodel.io;

/** Severity of a message sent to a {@link Diagnostics} sink */
public enum Severity {
	/** Progress information with no adverse effect */
	INFO,
	/** Something unexpected which the parser tolerated */
	WARNING,
	/** A problem which makes the current document unusable */
	ERROR,
	/** A structural problem which stopped the parse immediately */
	FATAL;
}

package org.fmimodel.model;

/** Categories of failure for a model description parse */
public enum ErrorKind {
	/** An element name outside the vocabulary */
	UNKNOWN_ELEMENT,
	/** An attribute name outside the vocabulary */
	UNKNOWN_ATTRIBUTE,
	/** A value of an enumerated attribute which is not one of its legal literals */
	UNKNOWN_ENUM_VALUE,
	/** An element where a different kind was expected */
	WRONG_ELEMENT_TYPE,
	/** An element missing where one was required, or elements left over at the end of the document */
	ILLEGAL_STRUCTURE,
	/** A block which may occur only once under the root occurred twice */
	DUPLICATE_BLOCK,
	/** The document is not well-formed XML */
	MALFORMED_XML,
	/** The document parsed, but post-parse validation found errors, e.g. a declaredType which names no Type */
	INVALID_REFERENCES;

	/** @return Whether this kind of error stops the parse as soon as it is found */
	public boolean isStructural() {
		return this != INVALID_REFERENCES;
	}
}

package org.fmimodel.model;

import org.fmimodel.vocab.AttributeName;

/** A single attribute of a {@link ModelElement}: the canonical name handle and the value text copied from the document */
public final class Attribute {
	private final AttributeName theName;
	private final String theValue;

	/**
	 * @param name The canonical attribute name
	 * @param value The attribute value
	 */
	public Attribute(AttributeName name, String value) {
		if (name == null || value == null)
			throw new NullPointerException();
		theName = name;
		theValue = value;
	}

	/** @return The canonical attribute name */
	public AttributeName getName() {
		return theName;
	}

	/** @return The attribute value */
	public String getValue() {
		return theValue;
	}

	@Override
	public String toString() {
		return theName.getXmlName() + "=" + theValue;
	}
}

package org.fmimodel.vocab;

/** All legal values of the enumeration-typed attributes, in table order */
public enum EnumLiteral implements XmlNamed {
	FLAT("flat"),
	STRUCTURED("structured"),
	CONSTANT("constant"),
	PARAMETER("parameter"),
	DISCRETE("discrete"),
	CONTINUOUS("continuous"),
	INPUT("input"),
	OUTPUT("output"),
	INTERNAL("internal"),
	NONE("none"),
	NO_ALIAS("noAlias"),
	ALIAS("alias"),
	NEGATED_ALIAS("negatedAlias");

	/** The table of all enum literals */
	public static final VocabularyTable<EnumLiteral> TABLE = new VocabularyTable<>("enum value", EnumLiteral.class);

	private final String theXmlName;

	private EnumLiteral(String xmlName) {
		theXmlName = xmlName;
	}

	@Override
	public String getXmlName() {
		return theXmlName;
	}

	/**
	 * @param xmlName The literal to look up
	 * @return The literal with the given spelling, or null if there is no such literal
	 */
	public static EnumLiteral forXmlName(String xmlName) {
		return TABLE.forXmlName(xmlName);
	}

	@Override
	public String toString() {
		return theXmlName;
	}
}

package org.fmimodel.vocab;

/** All element names recognized in a model description document, in table order */
public enum ElementKind implements XmlNamed {
	FMI_MODEL_DESCRIPTION("fmiModelDescription", NodeShape.MODEL_DESCRIPTION),
	UNIT_DEFINITIONS("UnitDefinitions", NodeShape.LIST),
	BASE_UNIT("BaseUnit", NodeShape.LIST),
	DISPLAY_UNIT_DEFINITION("DisplayUnitDefinition", NodeShape.ELEMENT),
	TYPE_DEFINITIONS("TypeDefinitions", NodeShape.LIST),
	TYPE("Type", NodeShape.TYPE),
	REAL_TYPE("RealType", NodeShape.ELEMENT),
	INTEGER_TYPE("IntegerType", NodeShape.ELEMENT),
	BOOLEAN_TYPE("BooleanType", NodeShape.ELEMENT),
	STRING_TYPE("StringType", NodeShape.ELEMENT),
	ENUMERATION_TYPE("EnumerationType", NodeShape.LIST),
	ITEM("Item", NodeShape.ELEMENT),
	DEFAULT_EXPERIMENT("DefaultExperiment", NodeShape.ELEMENT),
	VENDOR_ANNOTATIONS("VendorAnnotations", NodeShape.LIST),
	TOOL("Tool", NodeShape.LIST),
	ANNOTATION("Annotation", NodeShape.ELEMENT),
	MODEL_VARIABLES("ModelVariables", NodeShape.LIST),
	SCALAR_VARIABLE("ScalarVariable", NodeShape.SCALAR_VARIABLE),
	DIRECT_DEPENDENCY("DirectDependency", NodeShape.LIST),
	NAME("Name", NodeShape.ELEMENT),
	REAL("Real", NodeShape.ELEMENT),
	INTEGER("Integer", NodeShape.ELEMENT),
	BOOLEAN("Boolean", NodeShape.ELEMENT),
	STRING("String", NodeShape.ELEMENT),
	ENUMERATION("Enumeration", NodeShape.ELEMENT),
	IMPLEMENTATION("Implementation", NodeShape.ELEMENT),
	CO_SIMULATION_STAND_ALONE("CoSimulation_StandAlone", NodeShape.CO_SIMULATION),
	CO_SIMULATION_TOOL("CoSimulation_Tool", NodeShape.CO_SIMULATION),
	MODEL("Model", NodeShape.LIST),
	FILE("File", NodeShape.ELEMENT),
	CAPABILITIES("Capabilities", NodeShape.ELEMENT);

	/** The table of all element names */
	public static final VocabularyTable<ElementKind> TABLE = new VocabularyTable<>("element", ElementKind.class);

	private final String theXmlName;
	private final NodeShape theShape;

	private ElementKind(String xmlName, NodeShape shape) {
		theXmlName = xmlName;
		theShape = shape;
	}

	@Override
	public String getXmlName() {
		return theXmlName;
	}

	/** @return The shape of the node created for elements of this kind */
	public NodeShape getShape() {
		return theShape;
	}

	/** @return For {@link NodeShape#LIST list} kinds, the kind of every child in the list. Null for all other kinds. */
	public ElementKind getListChildKind() {
		switch (this) {
		case UNIT_DEFINITIONS:
			return BASE_UNIT;
		case BASE_UNIT:
			return DISPLAY_UNIT_DEFINITION;
		case TYPE_DEFINITIONS:
			return TYPE;
		case ENUMERATION_TYPE:
			return ITEM;
		case VENDOR_ANNOTATIONS:
			return TOOL;
		case TOOL:
			return ANNOTATION;
		case MODEL_VARIABLES:
			return SCALAR_VARIABLE;
		case DIRECT_DEPENDENCY:
			return NAME;
		case MODEL:
			return FILE;
		default:
			return null;
		}
	}

	/** @return Whether this kind may be the type-spec child of a {@link #TYPE Type} */
	public boolean isDeclaredTypeSpec() {
		switch (this) {
		case REAL_TYPE:
		case INTEGER_TYPE:
		case BOOLEAN_TYPE:
		case STRING_TYPE:
		case ENUMERATION_TYPE:
			return true;
		default:
			return false;
		}
	}

	/** @return Whether this kind may be the type-spec child of a {@link #SCALAR_VARIABLE ScalarVariable} */
	public boolean isVariableTypeSpec() {
		switch (this) {
		case REAL:
		case INTEGER:
		case BOOLEAN:
		case STRING:
		case ENUMERATION:
			return true;
		default:
			return false;
		}
	}

	/** @return Whether this is one of the two co-simulation block kinds */
	public boolean isCoSimulation() {
		return theShape == NodeShape.CO_SIMULATION;
	}

	/**
	 * Integer and Enumeration share a base type (and a value reference space), while Real, Boolean and String each define their own
	 *
	 * @param other The other variable type-spec kind
	 * @return Whether this kind and the other have the same base type
	 */
	public boolean hasSameBaseType(ElementKind other) {
		if (this == other)
			return true;
		return (this == ENUMERATION && other == INTEGER) || (this == INTEGER && other == ENUMERATION);
	}

	/**
	 * @param xmlName The element name to look up
	 * @return The element kind with the given name, or null if there is no such element
	 */
	public static ElementKind forXmlName(String xmlName) {
		return TABLE.forXmlName(xmlName);
	}

	@Override
	public String toString() {
		return theXmlName;
	}
}

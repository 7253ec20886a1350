package org.fmimodel.vocab;

import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * All attribute names recognized in a model description document, in table order. The constants of this enum are the canonical handles
 * stored by syntax tree nodes for their attribute names, so attribute names with the same spelling are always reference-identical.
 */
public enum AttributeName implements XmlNamed {
	FMI_VERSION("fmiVersion"),
	DISPLAY_UNIT("displayUnit"),
	GAIN("gain"),
	OFFSET("offset"),
	UNIT("unit"),
	NAME("name"),
	DESCRIPTION("description"),
	QUANTITY("quantity"),
	RELATIVE_QUANTITY("relativeQuantity"),
	MIN("min"),
	MAX("max"),
	NOMINAL("nominal"),
	DECLARED_TYPE("declaredType"),
	START("start"),
	FIXED("fixed"),
	START_TIME("startTime"),
	STOP_TIME("stopTime"),
	TOLERANCE("tolerance"),
	VALUE("value"),
	VALUE_REFERENCE("valueReference"),
	VARIABILITY("variability", EnumLiteral.CONTINUOUS, //
		EnumLiteral.CONSTANT, EnumLiteral.PARAMETER, EnumLiteral.DISCRETE, EnumLiteral.CONTINUOUS),
	CAUSALITY("causality", EnumLiteral.INTERNAL, //
		EnumLiteral.INPUT, EnumLiteral.OUTPUT, EnumLiteral.INTERNAL, EnumLiteral.NONE),
	ALIAS("alias", EnumLiteral.NO_ALIAS, //
		EnumLiteral.NO_ALIAS, EnumLiteral.ALIAS, EnumLiteral.NEGATED_ALIAS),
	MODEL_NAME("modelName"),
	MODEL_IDENTIFIER("modelIdentifier"),
	GUID("guid"),
	AUTHOR("author"),
	VERSION("version"),
	GENERATION_TOOL("generationTool"),
	GENERATION_DATE_AND_TIME("generationDateAndTime"),
	VARIABLE_NAMING_CONVENTION("variableNamingConvention", EnumLiteral.FLAT, //
		EnumLiteral.FLAT, EnumLiteral.STRUCTURED),
	NUMBER_OF_CONTINUOUS_STATES("numberOfContinuousStates"),
	NUMBER_OF_EVENT_INDICATORS("numberOfEventIndicators"),
	/** Not a real attribute in the document: holds the text content of a {@link ElementKind#NAME Name} element */
	INPUT("input"),
	CAN_HANDLE_VARIABLE_COMMUNICATION_STEP_SIZE("canHandleVariableCommunicationStepSize"),
	CAN_HANDLE_EVENTS("canHandleEvents"),
	CAN_REJECT_STEPS("canRejectSteps"),
	CAN_INTERPOLATE_INPUTS("canInterpolateInputs"),
	MAX_OUTPUT_DERIVATIVE_ORDER("maxOutputDerivativeOrder"),
	// Sic, this is the spelling used by the FMI 1.0 schema
	CAN_RUN_ASYNCHRONUOUSLY("canRunAsynchronuously"),
	CAN_SIGNAL_EVENTS("canSignalEvents"),
	CAN_BE_INSTANTIATED_ONLY_ONCE_PER_PROCESS("canBeInstantiatedOnlyOncePerProcess"),
	CAN_NOT_USE_MEMORY_MANAGEMENT_FUNCTIONS("canNotUseMemoryManagementFunctions"),
	FILE("file"),
	ENTRY_POINT("entryPoint"),
	MANUAL_START("manualStart"),
	TYPE("type");

	/** The table of all attribute names */
	public static final VocabularyTable<AttributeName> TABLE = new VocabularyTable<>("attribute", AttributeName.class);

	private final String theXmlName;
	private final EnumLiteral theDefault;
	private final Set<EnumLiteral> theLiterals;

	private AttributeName(String xmlName) {
		theXmlName = xmlName;
		theDefault = null;
		theLiterals = ImmutableSet.of();
	}

	private AttributeName(String xmlName, EnumLiteral defaultValue, EnumLiteral first, EnumLiteral... others) {
		theXmlName = xmlName;
		theDefault = defaultValue;
		theLiterals = Sets.immutableEnumSet(first, others);
	}

	@Override
	public String getXmlName() {
		return theXmlName;
	}

	/** @return Whether values of this attribute must be one of a fixed set of {@link EnumLiteral}s */
	public boolean isEnumerated() {
		return !theLiterals.isEmpty();
	}

	/** @return The legal values of this attribute, or an empty set if this attribute is not {@link #isEnumerated() enumerated} */
	public Set<EnumLiteral> getLegalLiterals() {
		return theLiterals;
	}

	/** @return The value assumed for this enumerated attribute when it is not specified, or null if there is none */
	public EnumLiteral getDefaultLiteral() {
		return theDefault;
	}

	/**
	 * @param xmlName The attribute name to look up
	 * @return The attribute with the given name, or null if there is no such attribute
	 */
	public static AttributeName forXmlName(String xmlName) {
		return TABLE.forXmlName(xmlName);
	}

	@Override
	public String toString() {
		return theXmlName;
	}
}

package org.fmimodel.model;

import java.util.List;

import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;
import org.fmimodel.vocab.EnumLiteral;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedInteger;

/**
 * <p>
 * The root of the syntax tree of a model description (the fmiModelDescription element).
 * </p>
 * <p>
 * Each of the root's blocks is optional and null if absent from the document. A block that is present but empty is an empty list. The
 * convenience accessors for attributes the schema requires assume the document was valid and throw {@link IllegalStateException} if
 * not.
 * </p>
 * <p>
 * A root returned from a successful parse belongs to the caller, who must {@link #release() release} it exactly once.
 * </p>
 */
public class ModelDescription extends ModelElement {
	private List<ListElement> theUnitDefinitions;
	private List<TypeDefinition> theTypeDefinitions;
	private ModelElement theDefaultExperiment;
	private List<ListElement> theVendorAnnotations;
	private List<ScalarVariable> theModelVariables;
	private CoSimulation theCoSimulation;

	ModelDescription(List<Attribute> attributes, AllocationTracker tracker) {
		super(ElementKind.FMI_MODEL_DESCRIPTION, attributes, tracker);
	}

	/** @return The BaseUnits of the UnitDefinitions block, or null if the block is absent */
	public List<ListElement> getUnitDefinitions() {
		return theUnitDefinitions;
	}

	/** @return The Types of the TypeDefinitions block, or null if the block is absent */
	public List<TypeDefinition> getTypeDefinitions() {
		return theTypeDefinitions;
	}

	/** @return The DefaultExperiment element, or null if absent */
	public ModelElement getDefaultExperiment() {
		return theDefaultExperiment;
	}

	/** @return The Tools of the VendorAnnotations block, or null if the block is absent */
	public List<ListElement> getVendorAnnotations() {
		return theVendorAnnotations;
	}

	/** @return The ScalarVariables of the ModelVariables block, or null if the block is absent */
	public List<ScalarVariable> getModelVariables() {
		return theModelVariables;
	}

	/** @return The co-simulation block, or null if the model is not for co-simulation */
	public CoSimulation getCoSimulation() {
		return theCoSimulation;
	}

	void setUnitDefinitions(List<ModelElement> units) {
		theUnitDefinitions = adoptAll(units, ListElement.class);
	}

	void setTypeDefinitions(List<ModelElement> types) {
		theTypeDefinitions = adoptAll(types, TypeDefinition.class);
	}

	void setDefaultExperiment(ModelElement experiment) {
		theDefaultExperiment = adopt(experiment);
	}

	void setVendorAnnotations(List<ModelElement> tools) {
		theVendorAnnotations = adoptAll(tools, ListElement.class);
	}

	void setModelVariables(List<ModelElement> variables) {
		theModelVariables = adoptAll(variables, ScalarVariable.class);
	}

	void setCoSimulation(CoSimulation coSimulation) {
		theCoSimulation = adopt(coSimulation);
	}

	private <E extends ModelElement> List<E> adoptAll(List<ModelElement> elements, Class<E> type) {
		ImmutableList.Builder<E> typed = ImmutableList.builder();
		for (ModelElement element : elements)
			typed.add(type.cast(element));
		List<E> list = typed.build();
		for (E element : list)
			adopt(element);
		return list;
	}

	/**
	 * @return The model identifier, used as prefix of the model's C functions
	 * @throws IllegalStateException If the required attribute is missing
	 */
	public String getModelIdentifier() throws IllegalStateException {
		return getRequiredString(AttributeName.MODEL_IDENTIFIER);
	}

	/**
	 * @return The number of continuous states of the model
	 * @throws IllegalStateException If the required attribute is missing or illegal
	 */
	public UnsignedInteger getNumberOfContinuousStates() throws IllegalStateException {
		return require(AttributeName.NUMBER_OF_CONTINUOUS_STATES, getUInt(AttributeName.NUMBER_OF_CONTINUOUS_STATES));
	}

	/**
	 * @return The number of event indicators of the model
	 * @throws IllegalStateException If the required attribute is missing or illegal
	 */
	public int getNumberOfEventIndicators() throws IllegalStateException {
		return require(AttributeName.NUMBER_OF_EVENT_INDICATORS, getInt(AttributeName.NUMBER_OF_EVENT_INDICATORS));
	}

	/**
	 * @param name The name of the variable, which is unique within a model
	 * @return The variable with the given name, or null if there is no such variable
	 */
	public ScalarVariable getVariableByName(String name) {
		if (theModelVariables == null)
			return null;
		for (ScalarVariable variable : theModelVariables) {
			if (name.equals(variable.getString(AttributeName.NAME)))
				return variable;
		}
		return null;
	}

	/**
	 * Value reference and type together do not uniquely identify a variable, so this may return an alias
	 *
	 * @param valueReference The value reference of the variable
	 * @param type The type-spec kind of the variable (Real, Integer, Boolean, String or Enumeration)
	 * @return The first variable with the given value reference and the same base type, or null if there is none or the value
	 *         reference is {@link ScalarVariable#UNDEFINED_VALUE_REFERENCE undefined}
	 */
	public ScalarVariable getVariable(UnsignedInteger valueReference, ElementKind type) {
		return findVariable(valueReference, type, false);
	}

	/**
	 * @param valueReference The value reference of the variable
	 * @param type The type-spec kind of the variable (Real, Integer, Boolean, String or Enumeration)
	 * @return The variable with the given value reference and the same base type which is not an alias, or null if there is none or the
	 *         value reference is {@link ScalarVariable#UNDEFINED_VALUE_REFERENCE undefined}
	 */
	public ScalarVariable getNonAliasVariable(UnsignedInteger valueReference, ElementKind type) {
		return findVariable(valueReference, type, true);
	}

	private ScalarVariable findVariable(UnsignedInteger valueReference, ElementKind type, boolean nonAlias) {
		if (theModelVariables == null || ScalarVariable.UNDEFINED_VALUE_REFERENCE.equals(valueReference))
			return null;
		for (ScalarVariable variable : theModelVariables) {
			if (!type.hasSameBaseType(variable.getTypeKind()) || !variable.getValueReference().equals(valueReference))
				continue;
			if (nonAlias && variable.getAlias() != EnumLiteral.NO_ALIAS)
				continue;
			return variable;
		}
		return null;
	}

	/**
	 * @param name The name of the declared type, may be null
	 * @return The Type with the given name, or null if the name is null or there is no such type
	 */
	public TypeDefinition getDeclaredType(String name) {
		if (name == null || theTypeDefinitions == null)
			return null;
		for (TypeDefinition type : theTypeDefinitions) {
			if (name.equals(type.getString(AttributeName.NAME)))
				return type;
		}
		return null;
	}

	/**
	 * Gets an attribute value from a type-spec, falling back to the type-spec of the type it declares, if any. The fall back is only one
	 * level deep.
	 *
	 * @param typeSpec The type-spec of a variable (or of a declared type)
	 * @param name The name of the attribute
	 * @return The attribute text, or null if neither the type-spec nor its declared type specifies it
	 */
	public String getInheritedString(ModelElement typeSpec, AttributeName name) {
		String value = typeSpec.getString(name);
		if (value != null)
			return value;
		TypeDefinition type = getDeclaredType(typeSpec.getString(AttributeName.DECLARED_TYPE));
		return type == null || type.getTypeSpec() == null ? null : type.getTypeSpec().getString(name);
	}

	/**
	 * @param typeSpec The type-spec of a variable (or of a declared type)
	 * @param name The name of the attribute
	 * @return The attribute, from the type-spec or its declared type, interpreted as a floating point number
	 * @see #getInheritedString(ModelElement, AttributeName)
	 */
	public AttributeValue<Double> getInheritedDouble(ModelElement typeSpec, AttributeName name) {
		if (typeSpec.getString(name) != null)
			return typeSpec.getDouble(name);
		TypeDefinition type = getDeclaredType(typeSpec.getString(AttributeName.DECLARED_TYPE));
		if (type == null || type.getTypeSpec() == null)
			return AttributeValue.missing(null);
		return type.getTypeSpec().getDouble(name);
	}

	/**
	 * @param variable The variable
	 * @return The variable's description, or its declared type's description if it has none, or null
	 */
	public String getDescription(ScalarVariable variable) {
		String value = variable.getString(AttributeName.DESCRIPTION);
		if (value != null)
			return value;
		TypeDefinition type = getDeclaredType(variable.getDeclaredTypeName());
		return type == null ? null : type.getDescription();
	}

	/**
	 * @param valueReference The value reference of the variable
	 * @param type The type-spec kind of the variable
	 * @param name The name of the type-spec attribute
	 * @return The attribute text from the variable's type-spec or its declared type, or null if there is no such variable or neither
	 *         specifies the attribute
	 */
	public String getVariableAttributeString(UnsignedInteger valueReference, ElementKind type, AttributeName name) {
		ScalarVariable variable = getVariable(valueReference, type);
		return variable == null ? null : getInheritedString(variable.getTypeSpec(), name);
	}

	/**
	 * @param valueReference The value reference of the variable
	 * @param type The type-spec kind of the variable
	 * @param name The name of the type-spec attribute
	 * @return The attribute from the variable's type-spec or its declared type, interpreted as a floating point number
	 */
	public AttributeValue<Double> getVariableAttributeDouble(UnsignedInteger valueReference, ElementKind type, AttributeName name) {
		ScalarVariable variable = getVariable(valueReference, type);
		return variable == null ? AttributeValue.missing(null) : getInheritedDouble(variable.getTypeSpec(), name);
	}

	/**
	 * @param valueReference The value reference of a Real variable
	 * @return The nominal value of the variable or of its declared type, or 1 if neither defines one
	 */
	public double getNominal(UnsignedInteger valueReference) {
		return getVariableAttributeDouble(valueReference, ElementKind.REAL, AttributeName.NOMINAL).orElse(1.0);
	}

	@Override
	public List<ModelElement> getChildren() {
		ImmutableList.Builder<ModelElement> children = ImmutableList.builder();
		if (theUnitDefinitions != null)
			children.addAll(theUnitDefinitions);
		if (theTypeDefinitions != null)
			children.addAll(theTypeDefinitions);
		if (theDefaultExperiment != null)
			children.add(theDefaultExperiment);
		if (theVendorAnnotations != null)
			children.addAll(theVendorAnnotations);
		if (theModelVariables != null)
			children.addAll(theModelVariables);
		if (theCoSimulation != null)
			children.add(theCoSimulation);
		return children.build();
	}

	@Override
	protected void clearChildren() {
		theUnitDefinitions = null;
		theTypeDefinitions = null;
		theDefaultExperiment = null;
		theVendorAnnotations = null;
		theModelVariables = null;
		theCoSimulation = null;
	}
}

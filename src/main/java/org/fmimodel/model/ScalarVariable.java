package org.fmimodel.model;

import java.util.List;

import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;
import org.fmimodel.vocab.EnumLiteral;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedInteger;

/** A variable of the model, with its type-spec (Real, Integer, Boolean, String or Enumeration) and optional direct dependencies */
public class ScalarVariable extends ModelElement {
	/** The value reference reserved to mean "no value reference" (fmiUndefinedValueReference) */
	public static final UnsignedInteger UNDEFINED_VALUE_REFERENCE = UnsignedInteger.MAX_VALUE;

	private ModelElement theTypeSpec;
	private List<ModelElement> theDirectDependencies;

	ScalarVariable(List<Attribute> attributes, AllocationTracker tracker) {
		super(ElementKind.SCALAR_VARIABLE, attributes, tracker);
	}

	/** @return The Real, Integer, Boolean, String or Enumeration element typing this variable */
	public ModelElement getTypeSpec() {
		return theTypeSpec;
	}

	/** @return The kind of this variable's type-spec */
	public ElementKind getTypeKind() {
		return theTypeSpec == null ? null : theTypeSpec.getKind();
	}

	/**
	 * Direct dependencies are only meaningful for outputs
	 *
	 * @return The Name elements listing the inputs this variable depends on directly, or null if the variable declared no
	 *         DirectDependency element
	 */
	public List<ModelElement> getDirectDependencies() {
		return theDirectDependencies;
	}

	/** @return The names of the inputs this variable depends on directly, or null if the variable declared no DirectDependency element */
	public List<String> getDirectDependencyNames() {
		if (theDirectDependencies == null)
			return null;
		ImmutableList.Builder<String> names = ImmutableList.builder();
		for (ModelElement name : theDirectDependencies)
			names.add(name.getString(AttributeName.INPUT));
		return names.build();
	}

	void setTypeSpec(ModelElement typeSpec) {
		if (!typeSpec.getKind().isVariableTypeSpec())
			throw new IllegalStateException(typeSpec.getKind() + " cannot type a variable");
		theTypeSpec = adopt(typeSpec);
	}

	void setDirectDependencies(List<ModelElement> dependencies) {
		for (ModelElement dep : dependencies)
			adopt(dep);
		theDirectDependencies = ImmutableList.copyOf(dependencies);
	}

	/**
	 * The value reference is unique only among variables of the same base type (Real, Integer or Enumeration, Boolean, String)
	 *
	 * @return This variable's value reference. May be {@link #UNDEFINED_VALUE_REFERENCE}.
	 * @throws IllegalStateException If the valueReference attribute is missing or illegal
	 */
	public UnsignedInteger getValueReference() throws IllegalStateException {
		return require(AttributeName.VALUE_REFERENCE, getUInt(AttributeName.VALUE_REFERENCE));
	}

	/** @return One of input, output, internal or none. Internal if the attribute is missing, null if it is illegal. */
	public EnumLiteral getCausality() {
		return getEnum(AttributeName.CAUSALITY).getValue();
	}

	/** @return One of constant, parameter, discrete or continuous. Continuous if the attribute is missing, null if it is illegal. */
	public EnumLiteral getVariability() {
		return getEnum(AttributeName.VARIABILITY).getValue();
	}

	/** @return One of noAlias, alias or negatedAlias. NoAlias if the attribute is missing, null if it is illegal. */
	public EnumLiteral getAlias() {
		return getEnum(AttributeName.ALIAS).getValue();
	}

	/** @return The declaredType attribute of this variable's type-spec, or null if it does not refer to a declared type */
	public String getDeclaredTypeName() {
		return theTypeSpec == null ? null : theTypeSpec.getString(AttributeName.DECLARED_TYPE);
	}

	@Override
	public List<ModelElement> getChildren() {
		ImmutableList.Builder<ModelElement> children = ImmutableList.builder();
		if (theTypeSpec != null)
			children.add(theTypeSpec);
		if (theDirectDependencies != null)
			children.addAll(theDirectDependencies);
		return children.build();
	}

	@Override
	protected void clearChildren() {
		theTypeSpec = null;
		theDirectDependencies = null;
	}
}

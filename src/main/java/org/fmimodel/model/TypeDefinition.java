package org.fmimodel.model;

import java.util.List;

import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;

import com.google.common.collect.ImmutableList;

/**
 * A user-named, reusable type (a Type element under TypeDefinitions). Variables refer to it by name with their declaredType attribute and
 * inherit the attributes of its type-spec that they do not specify themselves.
 */
public class TypeDefinition extends ModelElement {
	private ModelElement theTypeSpec;

	TypeDefinition(List<Attribute> attributes, AllocationTracker tracker) {
		super(ElementKind.TYPE, attributes, tracker);
	}

	/** @return The RealType, IntegerType, BooleanType, StringType or EnumerationType defining this type */
	public ModelElement getTypeSpec() {
		return theTypeSpec;
	}

	void setTypeSpec(ModelElement typeSpec) {
		if (!typeSpec.getKind().isDeclaredTypeSpec())
			throw new IllegalStateException(typeSpec.getKind() + " is not a type definition");
		theTypeSpec = adopt(typeSpec);
	}

	/** @return The type's description, or null if none was specified */
	public String getDescription() {
		return getString(AttributeName.DESCRIPTION);
	}

	@Override
	public List<ModelElement> getChildren() {
		return theTypeSpec == null ? ImmutableList.of() : ImmutableList.of(theTypeSpec);
	}

	@Override
	protected void clearChildren() {
		theTypeSpec = null;
	}
}

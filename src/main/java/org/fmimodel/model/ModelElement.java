package org.fmimodel.model;

import java.util.List;

import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;
import org.fmimodel.vocab.EnumLiteral;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedInteger;

/**
 * <p>
 * A node in the syntax tree of a model description document. Every node has an {@link ElementKind element kind}, which fixes the shape of
 * the node, and an ordered list of {@link Attribute attributes}.
 * </p>
 * <p>
 * Instances of this class itself are leaves. Subclasses carry children, each of which is owned exclusively by its parent. A tree is torn
 * down with {@link #release()}, which releases the node and all of its descendants.
 * </p>
 * <p>
 * The typed getters of this class never fail. Whether the attribute was present and readable is reported in the returned
 * {@link AttributeValue}'s {@link ValueStatus status}.
 * </p>
 */
public class ModelElement {
	private final ElementKind theKind;
	private final AllocationTracker theTracker;
	private List<Attribute> theAttributes;
	private boolean isComplete;
	private boolean isOwned;
	private boolean isReleased;

	/**
	 * @param kind The element kind of the node
	 * @param attributes The node's attributes
	 * @param tracker The tracker to notify when this node is released
	 */
	ModelElement(ElementKind kind, List<Attribute> attributes, AllocationTracker tracker) {
		theKind = kind;
		theAttributes = ImmutableList.copyOf(attributes);
		theTracker = tracker;
	}

	/**
	 * Creates a node of the shape dictated by the element kind
	 *
	 * @param kind The element kind of the node
	 * @param attributes The node's attributes
	 * @param tracker The tracker to notify of the node's creation and release
	 * @return The new node
	 */
	static ModelElement create(ElementKind kind, List<Attribute> attributes, AllocationTracker tracker) {
		ModelElement element;
		switch (kind.getShape()) {
		case ELEMENT:
			element = new ModelElement(kind, attributes, tracker);
			break;
		case LIST:
			element = new ListElement(kind, attributes, tracker);
			break;
		case TYPE:
			element = new TypeDefinition(attributes, tracker);
			break;
		case SCALAR_VARIABLE:
			element = new ScalarVariable(attributes, tracker);
			break;
		case CO_SIMULATION:
			element = new CoSimulation(kind, attributes, tracker);
			break;
		case MODEL_DESCRIPTION:
			element = new ModelDescription(attributes, tracker);
			break;
		default:
			throw new IllegalStateException("Unrecognized node shape: " + kind.getShape());
		}
		tracker.created(element);
		return element;
	}

	/** @return The element kind of this node */
	public ElementKind getKind() {
		return theKind;
	}

	/** @return This node's attributes, in document order */
	public List<Attribute> getAttributes() {
		return theAttributes;
	}

	void setAttributes(List<Attribute> attributes) {
		theAttributes = ImmutableList.copyOf(attributes);
	}

	/** @return The nodes owned by this node, in canonical order. Empty for leaves. */
	public List<ModelElement> getChildren() {
		return ImmutableList.of();
	}

	/** @return Whether this node's element has been closed and all its children attached */
	boolean isComplete() {
		return isComplete;
	}

	void complete() {
		isComplete = true;
	}

	/** @return Whether this node is currently owned by a parent node */
	public boolean isOwned() {
		return isOwned;
	}

	/** @return Whether this node has been {@link #release() released} */
	public boolean isReleased() {
		return isReleased;
	}

	/**
	 * @param name The name of the attribute
	 * @return The attribute text, or null if the attribute was not specified
	 */
	public String getString(AttributeName name) {
		for (Attribute att : theAttributes) {
			if (att.getName() == name)
				return att.getValue();
		}
		return null;
	}

	/**
	 * @param name The name of the attribute
	 * @return The attribute interpreted as a floating point number
	 */
	public AttributeValue<Double> getDouble(AttributeName name) {
		String value = getString(name);
		if (value == null)
			return AttributeValue.missing(null);
		try {
			return AttributeValue.defined(parseDouble(value.trim()));
		} catch (NumberFormatException e) {
			return AttributeValue.illegal();
		}
	}

	private static double parseDouble(String value) throws NumberFormatException {
		// Double.parseDouble also takes Java literal suffixes and hexadecimal floats, which are not XML doubles
		if (!value.isEmpty()) {
			char last = value.charAt(value.length() - 1);
			if (last == 'd' || last == 'D' || last == 'f' || last == 'F' || value.indexOf('x') >= 0 || value.indexOf('X') >= 0)
				throw new NumberFormatException("Not a decimal number: " + value);
		}
		return Double.parseDouble(value);
	}

	/**
	 * Also used for the values of enumeration-typed variables, e.g. the start value of a variable of a declared enumeration type
	 *
	 * @param name The name of the attribute
	 * @return The attribute interpreted as a signed 32-bit integer
	 */
	public AttributeValue<Integer> getInt(AttributeName name) {
		String value = getString(name);
		if (value == null)
			return AttributeValue.missing(null);
		try {
			return AttributeValue.defined(Integer.parseInt(value.trim()));
		} catch (NumberFormatException e) {
			return AttributeValue.illegal();
		}
	}

	/**
	 * @param name The name of the attribute
	 * @return The attribute interpreted as an unsigned 32-bit integer
	 */
	public AttributeValue<UnsignedInteger> getUInt(AttributeName name) {
		String value = getString(name);
		if (value == null)
			return AttributeValue.missing(null);
		try {
			return AttributeValue.defined(UnsignedInteger.valueOf(value.trim()));
		} catch (NumberFormatException e) {
			return AttributeValue.illegal();
		}
	}

	/**
	 * @param name The name of the attribute
	 * @return The attribute interpreted as a boolean. Only "true" and "false" are legal.
	 */
	public AttributeValue<Boolean> getBoolean(AttributeName name) {
		String value = getString(name);
		if (value == null)
			return AttributeValue.missing(null);
		switch (value) {
		case "true":
			return AttributeValue.defined(Boolean.TRUE);
		case "false":
			return AttributeValue.defined(Boolean.FALSE);
		default:
			return AttributeValue.illegal();
		}
	}

	/**
	 * @param name The name of the enumerated attribute
	 * @return The attribute's literal. If the attribute is missing, the value is the {@link AttributeName#getDefaultLiteral() default}
	 *         for the attribute, if it has one.
	 */
	public AttributeValue<EnumLiteral> getEnum(AttributeName name) {
		String value = getString(name);
		if (value == null)
			return AttributeValue.missing(name.getDefaultLiteral());
		EnumLiteral literal = EnumLiteral.forXmlName(value);
		if (literal == null || (name.isEnumerated() && !name.getLegalLiterals().contains(literal)))
			return AttributeValue.illegal();
		return AttributeValue.defined(literal);
	}

	/**
	 * The name is required for ScalarVariable, Type, Item, Annotation and Tool
	 *
	 * @return The value of this node's name attribute
	 * @throws IllegalStateException If the attribute is missing
	 */
	public String getName() throws IllegalStateException {
		return getRequiredString(AttributeName.NAME);
	}

	/**
	 * @param name The name of the required attribute
	 * @return The attribute text
	 * @throws IllegalStateException If the attribute is missing
	 */
	protected String getRequiredString(AttributeName name) throws IllegalStateException {
		String value = getString(name);
		if (value == null)
			throw new IllegalStateException("Required attribute " + name + " missing from " + theKind);
		return value;
	}

	/**
	 * @param <T> The type of the value
	 * @param name The name of the required attribute
	 * @param value The value read for the attribute
	 * @return The defined value
	 * @throws IllegalStateException If the value is not {@link ValueStatus#DEFINED defined}
	 */
	protected <T> T require(AttributeName name, AttributeValue<T> value) throws IllegalStateException {
		if (!value.isDefined())
			throw new IllegalStateException("Required attribute " + name + " of " + theKind + " is " + value.getStatus().name().toLowerCase()
				+ (value.getStatus() == ValueStatus.ILLEGAL ? ": " + getString(name) : ""));
		return value.getValue();
	}

	/**
	 * Takes ownership of a child node
	 *
	 * @param <E> The type of the child
	 * @param child The child to adopt, or null
	 * @return The child
	 * @throws IllegalStateException If the child is already owned or has been released
	 */
	protected <E extends ModelElement> E adopt(E child) throws IllegalStateException {
		if (child == null)
			return null;
		ModelElement node = child;
		if (node.isReleased)
			throw new IllegalStateException("Cannot attach released " + node.theKind + " to " + theKind);
		if (node.isOwned)
			throw new IllegalStateException(node.theKind + " is already owned by another node");
		node.isOwned = true;
		return child;
	}

	/**
	 * Gives up ownership of the given children so they may be adopted by another node
	 *
	 * @param children The children to disown
	 */
	protected static void disown(List<? extends ModelElement> children) {
		for (ModelElement child : children)
			child.isOwned = false;
	}

	/**
	 * Releases this node and, recursively, every node it owns
	 *
	 * @throws IllegalStateException If this node has already been released
	 */
	public void release() throws IllegalStateException {
		if (isReleased)
			throw new IllegalStateException(theKind + " has already been released");
		isReleased = true;
		for (ModelElement child : getChildren())
			child.release();
		clearChildren();
		theAttributes = ImmutableList.of();
		theTracker.released(this);
	}

	/** Drops references to all children after they have been released */
	protected void clearChildren() {
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder(theKind.getXmlName());
		for (Attribute att : theAttributes)
			str.append(' ').append(att);
		return str.toString();
	}
}

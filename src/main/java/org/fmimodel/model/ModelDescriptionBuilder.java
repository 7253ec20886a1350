package org.fmimodel.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.apache.log4j.Logger;
import org.fmimodel.io.Diagnostics;
import org.fmimodel.io.FilePosition;
import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;
import org.fmimodel.vocab.EnumLiteral;
import org.fmimodel.vocab.NodeShape;

import com.google.common.collect.ImmutableList;

/**
 * <p>
 * Builds the syntax tree of a model description from the start-tag, end-tag and character events of an XML tokenizer.
 * </p>
 * <p>
 * Each start tag creates a node and pushes it on a {@link NodeStack}. Each end tag runs the {@link ReductionRule} for the element's kind,
 * which pops the element's children, checks their kinds and attaches them to the element's node, leaving that node at the top of the
 * stack. When the document ends, the root is the only node left.
 * </p>
 * <p>
 * Any problem throws a {@link ModelDescriptionException}. The tokenizer must stop delivering events when that happens, and the caller must
 * then {@link #abort()} this builder, which releases every node it still owns. A builder is good for a single document.
 * </p>
 */
public class ModelDescriptionBuilder {
	private static final Logger log = Logger.getLogger(ModelDescriptionBuilder.class);

	/** The slots under the root which hold its blocks, in canonical order from the last block of the document to the first */
	private enum RootSlot {
		CO_SIMULATION, MODEL_VARIABLES, VENDOR_ANNOTATIONS, DEFAULT_EXPERIMENT, TYPE_DEFINITIONS, UNIT_DEFINITIONS;

		static RootSlot of(ElementKind kind) {
			switch (kind) {
			case CO_SIMULATION_STAND_ALONE:
			case CO_SIMULATION_TOOL:
				return CO_SIMULATION;
			case MODEL_VARIABLES:
				return MODEL_VARIABLES;
			case VENDOR_ANNOTATIONS:
				return VENDOR_ANNOTATIONS;
			case DEFAULT_EXPERIMENT:
				return DEFAULT_EXPERIMENT;
			case TYPE_DEFINITIONS:
				return TYPE_DEFINITIONS;
			case UNIT_DEFINITIONS:
				return UNIT_DEFINITIONS;
			default:
				return null;
			}
		}
	}

	private final NodeStack theStack;
	private final TextAccumulator theText;
	private final Diagnostics theDiagnostics;
	private final AllocationTracker theTracker;
	private final Map<ElementKind, ReductionRule> theRules;
	private Supplier<FilePosition> thePosition;
	private boolean isFinished;

	/**
	 * @param diagnostics The sink for warnings about tolerated problems in the document
	 * @param stackCapacity The initial capacity of the node stack
	 * @param tracker The tracker to notify of every node created and released
	 */
	public ModelDescriptionBuilder(Diagnostics diagnostics, int stackCapacity, AllocationTracker tracker) {
		theStack = new NodeStack(stackCapacity);
		theText = new TextAccumulator();
		theDiagnostics = diagnostics;
		theTracker = tracker;
		thePosition = () -> null;

		theRules = new EnumMap<>(ElementKind.class);
		theRules.put(ElementKind.FMI_MODEL_DESCRIPTION, this::reduceModelDescription);
		theRules.put(ElementKind.IMPLEMENTATION, this::reduceImplementation);
		theRules.put(ElementKind.CO_SIMULATION_STAND_ALONE, this::reduceCoSimulation);
		theRules.put(ElementKind.CO_SIMULATION_TOOL, this::reduceCoSimulation);
		theRules.put(ElementKind.TYPE, this::reduceType);
		theRules.put(ElementKind.SCALAR_VARIABLE, this::reduceScalarVariable);
		theRules.put(ElementKind.NAME, this::reduceName);
		for (ElementKind kind : ElementKind.values()) {
			if (kind.getShape() == NodeShape.LIST)
				theRules.put(kind, this::reduceList);
			else if (!theRules.containsKey(kind))
				theRules.put(kind, closed -> closed); // Leaf, already complete
		}
	}

	/**
	 * @param position Supplies the current position of the tokenizer in the document, for error messages
	 * @return This builder
	 */
	public ModelDescriptionBuilder withPosition(Supplier<FilePosition> position) {
		thePosition = position;
		return this;
	}

	/** @return The node stack of this builder */
	NodeStack getStack() {
		return theStack;
	}

	/**
	 * Creates the node for an element and pushes it on the stack
	 *
	 * @param elementName The name of the element
	 * @param attributes The element's attributes as alternating names and values
	 * @throws ModelDescriptionException If the element name, an attribute name or an enumerated attribute value is not in the vocabulary
	 */
	public void startElement(String elementName, String... attributes) throws ModelDescriptionException {
		ElementKind kind = checkElement(elementName);
		if (attributes.length % 2 != 0)
			throw new IllegalArgumentException("Attributes must be given as name/value pairs");
		ImmutableList.Builder<Attribute> atts = ImmutableList.builder();
		for (int i = 0; i < attributes.length; i += 2) {
			AttributeName name = AttributeName.forXmlName(attributes[i]);
			if (name == null)
				throw error(ErrorKind.UNKNOWN_ATTRIBUTE, "Illegal attribute " + attributes[i]);
			if (name.isEnumerated()) {
				EnumLiteral literal = EnumLiteral.forXmlName(attributes[i + 1]);
				if (literal == null || !name.getLegalLiterals().contains(literal))
					throw error(ErrorKind.UNKNOWN_ENUM_VALUE, "Illegal enum value " + attributes[i + 1] + " for attribute " + name);
			}
			atts.add(new Attribute(name, attributes[i + 1]));
		}
		if (kind == ElementKind.NAME)
			theText.start();
		else
			theText.stop();
		theStack.push(ModelElement.create(kind, atts.build(), theTracker));
	}

	/**
	 * @param ch The buffer containing character content
	 * @param start The start of the content in the buffer
	 * @param length The length of the content
	 */
	public void characters(char[] ch, int start, int length) {
		theText.append(ch, start, length);
	}

	/** @param content Character content of the current element */
	public void characters(String content) {
		theText.append(content);
	}

	/**
	 * Applies the reduction rule for an element being closed
	 *
	 * @param elementName The name of the element
	 * @throws ModelDescriptionException If the element's children are not as expected
	 */
	public void endElement(String elementName) throws ModelDescriptionException {
		ElementKind kind = checkElement(elementName);
		ElementKind expected = theRules.get(kind).reduce(kind);
		// All children are folded in, so the element itself must be on top now
		ModelElement top = checkPeek(expected);
		if (kind != ElementKind.IMPLEMENTATION) {
			checkOpen(top, kind);
			top.complete();
		}
	}

	/**
	 * Called when the document has ended
	 *
	 * @return The root of the syntax tree, which now belongs to the caller
	 * @throws ModelDescriptionException If the document did not reduce to a single fmiModelDescription node
	 */
	public ModelDescription finish() throws ModelDescriptionException {
		if (theStack.size() != 1) {
			throw error(ErrorKind.ILLEGAL_STRUCTURE,
				"Illegal document structure, expected a single " + ElementKind.FMI_MODEL_DESCRIPTION + " root but found " + theStack.size()
					+ " elements");
		}
		checkPeek(ElementKind.FMI_MODEL_DESCRIPTION);
		ModelDescription root = (ModelDescription) theStack.pop();
		theStack.claim(root);
		if (theStack.getDetachedCount() != 0)
			throw new IllegalStateException(theStack.getDetachedCount() + " nodes were popped but never attached");
		isFinished = true;
		return root;
	}

	/** Releases every node this builder still owns. Called once when the parse fails. */
	public void abort() {
		if (isFinished)
			return;
		if (log.isDebugEnabled())
			log.debug("Releasing " + theStack.size() + " live and " + theStack.getDetachedCount() + " detached nodes");
		theStack.releaseAll();
		theText.take();
		isFinished = true;
	}

	private ElementKind checkElement(String elementName) throws ModelDescriptionException {
		ElementKind kind = ElementKind.forXmlName(elementName);
		if (kind == null)
			throw error(ErrorKind.UNKNOWN_ELEMENT, "Illegal element " + elementName);
		return kind;
	}

	/**
	 * @param kind The kind expected at the top of the stack, or null to accept any kind
	 * @return The node at the top of the stack
	 * @throws ModelDescriptionException If the stack is empty or the top node is of a different kind
	 */
	private ModelElement checkPeek(ElementKind kind) throws ModelDescriptionException {
		if (theStack.isEmpty())
			throw error(ErrorKind.ILLEGAL_STRUCTURE, "Illegal document structure, expected " + (kind == null ? "xml element" : kind));
		ModelElement top = theStack.peek();
		if (kind != null && top.getKind() != kind)
			throw wrongType(kind.getXmlName(), top.getKind());
		return top;
	}

	/**
	 * @param kind The kind expected at the top of the stack, or null to accept any kind
	 * @return The node popped from the top of the stack
	 * @throws ModelDescriptionException If the stack is empty or the top node is of a different kind
	 */
	private ModelElement checkPop(ElementKind kind) throws ModelDescriptionException {
		checkPeek(kind);
		return theStack.pop();
	}

	/**
	 * @param node The node of the element being closed
	 * @param closed The kind of the element being closed
	 * @throws ModelDescriptionException If the node is a completed sibling of the same kind rather than the element being closed
	 */
	private void checkOpen(ModelElement node, ElementKind closed) throws ModelDescriptionException {
		if (node.isComplete())
			throw error(ErrorKind.WRONG_ELEMENT_TYPE, "Wrong element type, " + closed + " cannot contain " + node.getKind());
	}

	private void warn(String message) {
		FilePosition position = thePosition.get();
		theDiagnostics.warn(position == null ? message : position + ": " + message);
	}

	private ModelDescriptionException wrongType(String expected, ElementKind found) {
		return error(ErrorKind.WRONG_ELEMENT_TYPE, "Wrong element type, expected " + expected + ", found " + found);
	}

	private ModelDescriptionException error(ErrorKind kind, String message) {
		return new ModelDescriptionException(kind, message, thePosition.get());
	}

	/*
	 * Reduction rules. Each rule pops and checks everything it needs before it attaches anything, so that when a check fails all the
	 * popped nodes are still detached from the stack and are released by abort().
	 */

	private ElementKind reduceModelDescription(ElementKind closed) throws ModelDescriptionException {
		ModelElement[] slots = new ModelElement[RootSlot.values().length];
		RootSlot lastSlot = null;
		ModelElement child = checkPop(null);
		while (child.getKind() != ElementKind.FMI_MODEL_DESCRIPTION) {
			RootSlot slot = RootSlot.of(child.getKind());
			if (slot == null)
				throw wrongType(ElementKind.FMI_MODEL_DESCRIPTION.getXmlName(), child.getKind());
			if (slots[slot.ordinal()] != null) {
				throw error(ErrorKind.DUPLICATE_BLOCK,
					child.getKind() + " cannot occur together with " + slots[slot.ordinal()].getKind() + " in " + closed);
			}
			if (lastSlot != null && slot.compareTo(lastSlot) < 0) {
				if (slot == RootSlot.CO_SIMULATION)
					warn(child.getKind() + " placed before " + slots[lastSlot.ordinal()].getKind() + " in " + closed
						+ " (known SimulationX 3.x bug), accepted");
				else
					warn(child.getKind() + " out of order in " + closed + ", accepted");
			} else
				lastSlot = slot;
			slots[slot.ordinal()] = child;
			child = checkPop(null);
		}

		ModelDescription md = (ModelDescription) child;
		theStack.push(md);
		checkOpen(md, closed);
		ModelElement units = slots[RootSlot.UNIT_DEFINITIONS.ordinal()];
		if (units != null)
			md.setUnitDefinitions(dissolve((ListElement) units));
		ModelElement types = slots[RootSlot.TYPE_DEFINITIONS.ordinal()];
		if (types != null)
			md.setTypeDefinitions(dissolve((ListElement) types));
		ModelElement experiment = slots[RootSlot.DEFAULT_EXPERIMENT.ordinal()];
		if (experiment != null) {
			theStack.claim(experiment);
			md.setDefaultExperiment(experiment);
		}
		ModelElement annotations = slots[RootSlot.VENDOR_ANNOTATIONS.ordinal()];
		if (annotations != null)
			md.setVendorAnnotations(dissolve((ListElement) annotations));
		ModelElement variables = slots[RootSlot.MODEL_VARIABLES.ordinal()];
		if (variables != null)
			md.setModelVariables(dissolve((ListElement) variables));
		ModelElement coSimulation = slots[RootSlot.CO_SIMULATION.ordinal()];
		if (coSimulation != null) {
			theStack.claim(coSimulation);
			md.setCoSimulation((CoSimulation) coSimulation);
		}
		return closed;
	}

	/** Takes the list out of a popped wrapper element and releases the wrapper */
	private List<ModelElement> dissolve(ListElement wrapper) {
		theStack.claim(wrapper);
		List<ModelElement> list = wrapper.takeList();
		wrapper.release();
		return list;
	}

	private ElementKind reduceImplementation(ElementKind closed) throws ModelDescriptionException {
		ModelElement payload = checkPop(null);
		if (!payload.getKind().isCoSimulation())
			throw wrongType(ElementKind.CO_SIMULATION_STAND_ALONE + " or " + ElementKind.CO_SIMULATION_TOOL, payload.getKind());
		ModelElement implementation = checkPop(ElementKind.IMPLEMENTATION);
		theStack.push(payload);
		theStack.claim(implementation);
		implementation.release();
		return payload.getKind();
	}

	private ElementKind reduceCoSimulation(ElementKind closed) throws ModelDescriptionException {
		ListElement model = null;
		if (closed == ElementKind.CO_SIMULATION_TOOL)
			model = (ListElement) checkPop(ElementKind.MODEL);
		ModelElement capabilities = checkPop(ElementKind.CAPABILITIES);
		CoSimulation cs = (CoSimulation) checkPop(closed);
		theStack.push(cs);
		checkOpen(cs, closed);
		theStack.claim(capabilities);
		cs.setCapabilities(capabilities);
		if (model != null) {
			theStack.claim(model);
			cs.setModel(model);
		}
		return closed;
	}

	private ElementKind reduceType(ElementKind closed) throws ModelDescriptionException {
		ModelElement typeSpec = checkPop(null);
		if (!typeSpec.getKind().isDeclaredTypeSpec())
			throw wrongType("RealType or similar", typeSpec.getKind());
		TypeDefinition type = (TypeDefinition) checkPeek(ElementKind.TYPE);
		checkOpen(type, closed);
		theStack.claim(typeSpec);
		type.setTypeSpec(typeSpec);
		return closed;
	}

	private ElementKind reduceScalarVariable(ElementKind closed) throws ModelDescriptionException {
		ListElement dependencies = null;
		ModelElement typeSpec = checkPop(null);
		if (typeSpec.getKind() == ElementKind.DIRECT_DEPENDENCY) {
			dependencies = (ListElement) typeSpec;
			typeSpec = checkPop(null);
		}
		if (!typeSpec.getKind().isVariableTypeSpec())
			throw wrongType("Real or similar", typeSpec.getKind());
		ScalarVariable variable = (ScalarVariable) checkPeek(ElementKind.SCALAR_VARIABLE);
		checkOpen(variable, closed);
		theStack.claim(typeSpec);
		variable.setTypeSpec(typeSpec);
		if (dependencies != null)
			variable.setDirectDependencies(dissolve(dependencies));
		return closed;
	}

	private ElementKind reduceList(ElementKind closed) throws ModelDescriptionException {
		ElementKind childKind = closed.getListChildKind();
		int count = 0;
		ModelElement node = checkPop(null);
		while (node.getKind() == childKind) {
			node = checkPop(null);
			count++;
		}
		theStack.push(node);
		if (node.getKind() != closed)
			throw wrongType(closed.getXmlName(), node.getKind());
		checkOpen(node, closed);
		((ListElement) node).setList(theStack.popLastAsList(count));
		return closed;
	}

	private ElementKind reduceName(ElementKind closed) throws ModelDescriptionException {
		// The one element whose value is its content instead of an attribute
		ModelElement name = checkPeek(ElementKind.NAME);
		checkOpen(name, closed);
		name.setAttributes(ImmutableList.of(new Attribute(AttributeName.INPUT, theText.take())));
		return closed;
	}
}

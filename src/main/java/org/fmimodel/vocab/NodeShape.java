package org.fmimodel.vocab;

/** The shape of the syntax tree node created for an element kind */
public enum NodeShape {
	/** A node with attributes only */
	ELEMENT,
	/** A node with attributes and an ordered list of homogeneous children */
	LIST,
	/** A declared type: attributes plus a single type-spec child */
	TYPE,
	/** A scalar variable: attributes, a type-spec child and optional direct dependencies */
	SCALAR_VARIABLE,
	/** A co-simulation block: attributes, capabilities and (tool variant only) a model */
	CO_SIMULATION,
	/** The document root */
	MODEL_DESCRIPTION;
}

package org.fmimodel.vocab;

/** An entry of one of the fixed vocabularies, known by its exact (case-sensitive) spelling in the XML */
public interface XmlNamed {
	/** @return The name of this entry as it appears in a model description document */
	String getXmlName();
}

package org.fmimodel.model;

import java.util.List;

import org.fmimodel.vocab.ElementKind;

import com.google.common.collect.ImmutableList;

/** The CoSimulation_StandAlone or CoSimulation_Tool block of a model description */
public class CoSimulation extends ModelElement {
	private ModelElement theCapabilities;
	private ListElement theModel;

	CoSimulation(ElementKind kind, List<Attribute> attributes, AllocationTracker tracker) {
		super(kind, attributes, tracker);
	}

	/** @return Whether this block describes a tool-hosted model (CoSimulation_Tool) */
	public boolean isToolHosted() {
		return getKind() == ElementKind.CO_SIMULATION_TOOL;
	}

	/** @return The Capabilities element of this block */
	public ModelElement getCapabilities() {
		return theCapabilities;
	}

	/** @return The Model element (a list of Files) describing the tool-hosted model, or null for a stand-alone block */
	public ListElement getModel() {
		return theModel;
	}

	void setCapabilities(ModelElement capabilities) {
		theCapabilities = adopt(capabilities);
	}

	void setModel(ListElement model) {
		if (!isToolHosted())
			throw new IllegalStateException(getKind() + " cannot carry a model");
		theModel = adopt(model);
	}

	@Override
	public List<ModelElement> getChildren() {
		ImmutableList.Builder<ModelElement> children = ImmutableList.builder();
		if (theCapabilities != null)
			children.add(theCapabilities);
		if (theModel != null)
			children.add(theModel);
		return children.build();
	}

	@Override
	protected void clearChildren() {
		theCapabilities = null;
		theModel = null;
	}
}

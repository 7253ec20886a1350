package org.fmimodel.model;

import java.util.List;

import org.fmimodel.vocab.ElementKind;

import com.google.common.collect.ImmutableList;

/**
 * A node holding an ordered list of children which all have the same {@link ElementKind#getListChildKind() kind}, e.g. the
 * ScalarVariables under ModelVariables or the Items of an EnumerationType
 */
public class ListElement extends ModelElement {
	private List<ModelElement> theList;

	ListElement(ElementKind kind, List<Attribute> attributes, AllocationTracker tracker) {
		super(kind, attributes, tracker);
	}

	/** @return The kind of every element in this node's list */
	public ElementKind getChildKind() {
		return getKind().getListChildKind();
	}

	/** @return This node's list, in document order. Empty if the element had no children, null only before the element is closed. */
	public List<ModelElement> getList() {
		return theList;
	}

	void setList(List<ModelElement> list) {
		if (theList != null)
			throw new IllegalStateException(getKind() + " list is already set");
		for (ModelElement child : list) {
			if (child.getKind() != getChildKind())
				throw new IllegalStateException(child.getKind() + " cannot be a child of " + getKind());
		}
		for (ModelElement child : list)
			adopt(child);
		theList = ImmutableList.copyOf(list);
	}

	/**
	 * Gives this node's list away, leaving this node empty. Used when a wrapper element is dissolved into its parent.
	 *
	 * @return The list, whose elements are no longer owned by this node
	 */
	List<ModelElement> takeList() {
		List<ModelElement> list = theList == null ? ImmutableList.of() : theList;
		disown(list);
		theList = null;
		return list;
	}

	@Override
	public List<ModelElement> getChildren() {
		return theList == null ? ImmutableList.of() : theList;
	}

	@Override
	protected void clearChildren() {
		theList = null;
	}
}

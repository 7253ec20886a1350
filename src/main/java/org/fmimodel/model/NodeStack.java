package org.fmimodel.model;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * <p>
 * The stack of partially built syntax tree nodes used while parsing a document.
 * </p>
 * <p>
 * Popping a node does not erase it from its slot: the slots above the top of the stack hold the most recently popped nodes until later
 * pushes overwrite them. {@link #popLastAsList(int)} uses this history to hand back a run of popped siblings in their original order.
 * </p>
 * <p>
 * The stack also keeps account of ownership. A node that has been popped and neither pushed back nor {@link #claim(ModelElement) claimed}
 * by a new owner is "detached". {@link #releaseAll()} releases everything the stack still owns, live and detached, exactly once.
 * </p>
 */
public class NodeStack {
	/** The default initial number of slots in a stack */
	public static final int DEFAULT_CAPACITY = 100;

	private ModelElement[] theSlots;
	private int theSize;
	private int theHistoryEnd;
	private final Set<ModelElement> theDetached;

	/** Creates a stack with the {@link #DEFAULT_CAPACITY default capacity} */
	public NodeStack() {
		this(DEFAULT_CAPACITY);
	}

	/** @param capacity The initial number of slots in the stack. The stack grows as needed. */
	public NodeStack(int capacity) {
		if (capacity < 1)
			throw new IllegalArgumentException("Capacity must be positive: " + capacity);
		theSlots = new ModelElement[capacity];
		theDetached = Sets.newIdentityHashSet();
	}

	/** @param element The node to push onto the stack */
	public void push(ModelElement element) {
		if (element == null)
			throw new NullPointerException();
		if (theSize == theSlots.length)
			theSlots = Arrays.copyOf(theSlots, theSlots.length * 2);
		theSlots[theSize++] = element;
		if (theHistoryEnd < theSize)
			theHistoryEnd = theSize;
		theDetached.remove(element);
	}

	/**
	 * @return The node that was at the top of the stack
	 * @throws NoSuchElementException If the stack is empty
	 */
	public ModelElement pop() throws NoSuchElementException {
		if (theSize == 0)
			throw new NoSuchElementException("Stack is empty");
		ModelElement element = theSlots[--theSize];
		theDetached.add(element);
		return element;
	}

	/**
	 * @return The node at the top of the stack, which remains there
	 * @throws NoSuchElementException If the stack is empty
	 */
	public ModelElement peek() throws NoSuchElementException {
		if (theSize == 0)
			throw new NoSuchElementException("Stack is empty");
		return theSlots[theSize - 1];
	}

	/** @return Whether the stack is empty */
	public boolean isEmpty() {
		return theSize == 0;
	}

	/** @return The number of nodes on the stack */
	public int size() {
		return theSize;
	}

	/**
	 * Returns the <code>count</code> nodes most recently popped from directly above the current top of the stack, in the order in which
	 * they were originally pushed. Ownership of the returned nodes passes to the caller, and the history above the top is cleared.
	 *
	 * @param count The number of popped nodes to return
	 * @return The popped nodes, in push order. Empty if count is zero.
	 * @throws IllegalStateException If fewer than <code>count</code> popped nodes are retained above the top
	 */
	public List<ModelElement> popLastAsList(int count) throws IllegalStateException {
		if (count < 0 || theSize + count > theHistoryEnd)
			throw new IllegalStateException("Only " + (theHistoryEnd - theSize) + " popped nodes retained, " + count + " requested");
		ImmutableList.Builder<ModelElement> popped = ImmutableList.builder();
		for (int i = 0; i < count; i++) {
			ModelElement element = theSlots[theSize + i];
			popped.add(element);
			theDetached.remove(element);
		}
		Arrays.fill(theSlots, theSize, theHistoryEnd, null);
		theHistoryEnd = theSize;
		return popped.build();
	}

	/**
	 * Records that a popped node has been given a new owner, so the stack will no longer release it
	 *
	 * @param element The node that has been claimed
	 * @throws IllegalStateException If the node was not popped from this stack or has already been claimed
	 */
	public void claim(ModelElement element) throws IllegalStateException {
		if (!theDetached.remove(element))
			throw new IllegalStateException(element.getKind() + " is not a detached node of this stack");
	}

	/** @return The number of popped nodes which have been neither pushed back nor claimed */
	public int getDetachedCount() {
		return theDetached.size();
	}

	/**
	 * Releases every node still owned by this stack (all live nodes and all detached nodes) and empties it. Nodes which were claimed are
	 * not touched.
	 */
	public void releaseAll() {
		while (theSize > 0) {
			ModelElement element = theSlots[--theSize];
			theSlots[theSize] = null;
			element.release();
		}
		for (ModelElement element : theDetached)
			element.release();
		theDetached.clear();
		Arrays.fill(theSlots, null);
		theHistoryEnd = 0;
	}
}

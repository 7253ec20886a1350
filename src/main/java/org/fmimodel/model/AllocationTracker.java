package org.fmimodel.model;

/** Receives notice of every syntax tree node created and released by a parse. Used to account for node ownership. */
public interface AllocationTracker {
	/** Ignores all notifications */
	AllocationTracker NONE = new AllocationTracker() {
		@Override
		public void created(ModelElement element) {
		}

		@Override
		public void released(ModelElement element) {
		}
	};

	/** @param element The node that was just created */
	void created(ModelElement element);

	/** @param element The node that was just released */
	void released(ModelElement element);
}

package org.fmimodel.io;

/**
 * A one-way channel for messages about a parse. Notifying a sink never affects the parse itself, regardless of severity; the parser
 * decides separately whether to stop.
 */
public interface Diagnostics {
	/** Discards all messages */
	Diagnostics NONE = (severity, message) -> {
	};

	/**
	 * @param severity The severity of the message
	 * @param message The message
	 */
	void notify(Severity severity, String message);

	/** @param message The informational message */
	default void info(String message) {
		notify(Severity.INFO, message);
	}

	/** @param message The warning message */
	default void warn(String message) {
		notify(Severity.WARNING, message);
	}

	/** @param message The error message */
	default void error(String message) {
		notify(Severity.ERROR, message);
	}

	/** @param message The message describing the fatal problem */
	default void fatal(String message) {
		notify(Severity.FATAL, message);
	}
}

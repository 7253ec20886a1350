package org.fmimodel.io;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/** The default {@link Diagnostics} sink, which writes each message to a log4j logger */
public class Log4jDiagnostics implements Diagnostics {
	private static final Logger log = Logger.getLogger(Log4jDiagnostics.class);

	private final Logger theLogger;

	/** Creates a sink logging to this class's logger */
	public Log4jDiagnostics() {
		this(log);
	}

	/** @param logger The logger to write messages to */
	public Log4jDiagnostics(Logger logger) {
		theLogger = logger;
	}

	/** @return The logger this sink writes to */
	public Logger getLogger() {
		return theLogger;
	}

	@Override
	public void notify(Severity severity, String message) {
		theLogger.log(toLevel(severity), message);
	}

	/**
	 * @param severity The diagnostic severity
	 * @return The log4j level to log messages of the given severity at
	 */
	public static Level toLevel(Severity severity) {
		switch (severity) {
		case INFO:
			return Level.INFO;
		case WARNING:
			return Level.WARN;
		case ERROR:
			return Level.ERROR;
		case FATAL:
			return Level.FATAL;
		}
		throw new IllegalStateException("Unrecognized severity: " + severity);
	}
}

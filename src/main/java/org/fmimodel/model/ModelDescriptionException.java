package org.fmimodel.model;

import java.text.ParseException;

import org.fmimodel.io.FilePosition;

/** Thrown when a model description document cannot be parsed into a valid syntax tree */
public class ModelDescriptionException extends ParseException {
	private final ErrorKind theKind;
	private final FilePosition thePosition;

	/**
	 * @param kind The category of the failure
	 * @param message The message describing the failure
	 * @param position The position in the document where the failure was detected, or null if unknown
	 */
	public ModelDescriptionException(ErrorKind kind, String message, FilePosition position) {
		super(message, position == null ? 0 : Math.max(0, position.getLineNumber()));
		theKind = kind;
		thePosition = position;
	}

	/**
	 * @param kind The category of the failure
	 * @param message The message describing the failure
	 * @param position The position in the document where the failure was detected, or null if unknown
	 * @param cause The cause of the failure
	 */
	public ModelDescriptionException(ErrorKind kind, String message, FilePosition position, Throwable cause) {
		this(kind, message, position);
		initCause(cause);
	}

	/** @return The category of the failure */
	public ErrorKind getKind() {
		return theKind;
	}

	/** @return The position in the document where the failure was detected, or null if unknown */
	public FilePosition getPosition() {
		return thePosition;
	}

	/** @return The message, prefixed by the position if it is known */
	public String getDescription() {
		if (thePosition == null)
			return getMessage();
		return thePosition + ": " + getMessage();
	}

	@Override
	public String toString() {
		return getClass().getName() + " (" + theKind + "): " + getDescription();
	}
}

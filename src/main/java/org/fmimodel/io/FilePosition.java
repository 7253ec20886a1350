package org.fmimodel.io;

import java.util.Objects;

/** The position of a character in a document being parsed, as reported by the XML tokenizer */
public class FilePosition {
	private final String theSource;
	private final int theLineNumber;
	private final int theColumnNumber;

	/**
	 * @param source The name of the document (typically its path), or null if unknown
	 * @param lineNumber The line number in the document, starting at 1, or &lt;=0 if unknown
	 * @param columnNumber The column number in the line, starting at 1, or &lt;=0 if unknown
	 */
	public FilePosition(String source, int lineNumber, int columnNumber) {
		theSource = source;
		theLineNumber = lineNumber;
		theColumnNumber = columnNumber;
	}

	/** @return The name of the document (typically its path), or null if unknown */
	public String getSource() {
		return theSource;
	}

	/** @return The line number in the document, starting at 1, or &lt;=0 if unknown */
	public int getLineNumber() {
		return theLineNumber;
	}

	/** @return The column number in the line, starting at 1, or &lt;=0 if unknown */
	public int getColumnNumber() {
		return theColumnNumber;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theSource, theLineNumber, theColumnNumber);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FilePosition))
			return false;
		FilePosition other = (FilePosition) obj;
		return Objects.equals(theSource, other.theSource) && theLineNumber == other.theLineNumber
			&& theColumnNumber == other.theColumnNumber;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		if (theSource != null)
			str.append(theSource).append(':');
		str.append('L').append(theLineNumber);
		if (theColumnNumber > 0)
			str.append(",C").append(theColumnNumber);
		return str.toString();
	}
}

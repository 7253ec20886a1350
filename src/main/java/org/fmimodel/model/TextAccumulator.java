package org.fmimodel.model;

import java.nio.CharBuffer;

/**
 * Collects the text content of the one element kind whose value is carried as content instead of as an attribute (Name). The tokenizer
 * may deliver the content in any number of fragments, which are concatenated in arrival order.
 */
public class TextAccumulator {
	private StringBuilder theText;
	private boolean isRecording;

	/** Starts recording content for a new element, discarding anything recorded before */
	public void start() {
		theText = null;
		isRecording = true;
	}

	/** Stops recording. Content passed to {@link #append(CharSequence)} is ignored until the next {@link #start()}. */
	public void stop() {
		isRecording = false;
	}

	/** @return Whether content is currently being recorded */
	public boolean isRecording() {
		return isRecording;
	}

	/**
	 * A single newline arriving as the first fragment counts as nothing, since some tokenizers report it for empty content
	 *
	 * @param fragment The next fragment of content
	 * @return This accumulator
	 */
	public TextAccumulator append(CharSequence fragment) {
		if (!isRecording)
			return this;
		if (theText == null) {
			theText = new StringBuilder();
			if (fragment.length() == 1 && fragment.charAt(0) == '\n')
				return this;
		}
		theText.append(fragment);
		return this;
	}

	/**
	 * @param ch The buffer containing the fragment
	 * @param start The start of the fragment in the buffer
	 * @param length The length of the fragment
	 * @return This accumulator
	 */
	public TextAccumulator append(char[] ch, int start, int length) {
		if (!isRecording)
			return this;
		return append(CharBuffer.wrap(ch, start, length));
	}

	/**
	 * Takes the recorded content, resets this accumulator and stops recording
	 *
	 * @return The content recorded since the last {@link #start()}, or the empty string if nothing was recorded
	 */
	public String take() {
		String text = theText == null ? "" : theText.toString();
		theText = null;
		isRecording = false;
		return text;
	}
}

package org.fmimodel.model;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes a syntax tree as indented text, one node per line: the element name followed by its attributes as <code>name=value</code>,
 * with each level of children indented further than its parent. Children appear in canonical order.
 */
public class ModelDescriptionPrinter {
	/** The default number of spaces each level of the tree is indented by */
	public static final int DEFAULT_INDENT = 2;

	private final int theIndent;

	/** Creates a printer with the {@link #DEFAULT_INDENT default indent} */
	public ModelDescriptionPrinter() {
		this(DEFAULT_INDENT);
	}

	/** @param indent The number of spaces each level of the tree is indented by */
	public ModelDescriptionPrinter(int indent) {
		if (indent < 0)
			throw new IllegalArgumentException("Negative indent: " + indent);
		theIndent = indent;
	}

	/**
	 * @param element The root of the tree to print
	 * @return The printed tree
	 */
	public String print(ModelElement element) {
		StringBuilder str = new StringBuilder();
		print(element, str);
		return str.toString();
	}

	/**
	 * @param element The root of the tree to print
	 * @param out The target to print to
	 * @throws UncheckedIOException If the target throws an {@link IOException}
	 */
	public void print(ModelElement element, Appendable out) {
		try {
			print(element, out, 0);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private void print(ModelElement element, Appendable out, int depth) throws IOException {
		for (int i = 0; i < depth * theIndent; i++)
			out.append(' ');
		out.append(element.toString()).append('\n');
		for (ModelElement child : element.getChildren())
			print(child, out, depth + 1);
	}
}

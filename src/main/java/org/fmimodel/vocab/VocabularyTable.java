package org.fmimodel.vocab;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A closed, ordered table of vocabulary entries. Each entry's position in the table is its enum ordinal. This is the only place where
 * text from a document is compared against the vocabulary.
 *
 * @param <E> The type of entry in the table
 */
public final class VocabularyTable<E extends Enum<E> & XmlNamed> {
	private final String theKind;
	private final ImmutableList<E> theEntries;
	private final ImmutableMap<String, E> theByName;

	/**
	 * @param kind A description of the kind of names in the table, e.g. "element"
	 * @param type The enum type of the entries
	 */
	public VocabularyTable(String kind, Class<E> type) {
		theKind = kind;
		theEntries = ImmutableList.copyOf(type.getEnumConstants());
		ImmutableMap.Builder<String, E> byName = ImmutableMap.builder();
		for (E entry : theEntries)
			byName.put(entry.getXmlName(), entry);
		theByName = byName.build();
	}

	/** @return A description of the kind of names in this table, e.g. "element" */
	public String getKind() {
		return theKind;
	}

	/** @return All entries in this table, in table order */
	public List<E> getEntries() {
		return theEntries;
	}

	/**
	 * @param xmlName The name to look up
	 * @return The entry with the given name, or null if the name is not in this table
	 */
	public E forXmlName(String xmlName) {
		return xmlName == null ? null : theByName.get(xmlName);
	}

	/**
	 * @param position The 0-based position of the entry in the table
	 * @return The entry at the given position
	 */
	public E get(int position) {
		return theEntries.get(position);
	}

	/** @return The number of entries in this table */
	public int size() {
		return theEntries.size();
	}

	@Override
	public String toString() {
		return theKind + " vocabulary (" + theEntries.size() + ")";
	}
}

package org.fmimodel.model;

import java.util.Objects;

/**
 * A typed attribute value together with the {@link ValueStatus status} of the read. A {@link ValueStatus#MISSING missing} value may
 * still carry a value, the default for the attribute, if it has one.
 *
 * @param <T> The type of the value
 */
public final class AttributeValue<T> {
	private static final AttributeValue<?> MISSING = new AttributeValue<>(null, ValueStatus.MISSING);
	private static final AttributeValue<?> ILLEGAL = new AttributeValue<>(null, ValueStatus.ILLEGAL);

	private final T theValue;
	private final ValueStatus theStatus;

	private AttributeValue(T value, ValueStatus status) {
		theValue = value;
		theStatus = status;
	}

	/** @return The value, or the attribute's default if missing, or null if illegal or missing with no default */
	public T getValue() {
		return theValue;
	}

	/** @return The status of the read */
	public ValueStatus getStatus() {
		return theStatus;
	}

	/** @return Whether the attribute was specified and interpretable */
	public boolean isDefined() {
		return theStatus == ValueStatus.DEFINED;
	}

	/**
	 * @param other The value to use if this value is not {@link #isDefined() defined}
	 * @return This value if defined, otherwise the given value
	 */
	public T orElse(T other) {
		return theStatus == ValueStatus.DEFINED ? theValue : other;
	}

	/**
	 * @param <T> The type of the value
	 * @param value The parsed value
	 * @return A {@link ValueStatus#DEFINED defined} value
	 */
	public static <T> AttributeValue<T> defined(T value) {
		return new AttributeValue<>(value, ValueStatus.DEFINED);
	}

	/**
	 * @param <T> The type of the value
	 * @param defaultValue The default value for the attribute, or null if it has none
	 * @return A {@link ValueStatus#MISSING missing} value
	 */
	@SuppressWarnings("unchecked")
	public static <T> AttributeValue<T> missing(T defaultValue) {
		if (defaultValue == null)
			return (AttributeValue<T>) MISSING;
		return new AttributeValue<>(defaultValue, ValueStatus.MISSING);
	}

	/**
	 * @param <T> The type of the value
	 * @return An {@link ValueStatus#ILLEGAL illegal} value
	 */
	@SuppressWarnings("unchecked")
	public static <T> AttributeValue<T> illegal() {
		return (AttributeValue<T>) ILLEGAL;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theValue, theStatus);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof AttributeValue))
			return false;
		AttributeValue<?> other = (AttributeValue<?>) obj;
		return theStatus == other.theStatus && Objects.equals(theValue, other.theValue);
	}

	@Override
	public String toString() {
		switch (theStatus) {
		case DEFINED:
			return String.valueOf(theValue);
		case MISSING:
			return theValue == null ? "<missing>" : "<missing, default " + theValue + ">";
		default:
			return "<illegal>";
		}
	}
}

package org.fmimodel.model;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;

import org.apache.log4j.Logger;
import org.fmimodel.io.Diagnostics;
import org.fmimodel.io.FilePosition;
import org.fmimodel.io.Log4jDiagnostics;
import org.xml.sax.Attributes;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * <p>
 * Parses modelDescription.xml files into {@link ModelDescription} trees.
 * </p>
 * <p>
 * The XML is tokenized by the JDK's SAX parser, whose events drive a {@link ModelDescriptionBuilder}. The finished tree is then checked
 * by a {@link ModelDescriptionValidator}. Progress and problems are reported to a {@link Diagnostics} sink, which logs to log4j by
 * default. If anything goes wrong, every node created for the document is released and a {@link ModelDescriptionException} is thrown.
 * </p>
 * <p>
 * Each parse is independent of every other. An instance may be reused, but is not thread-safe while it is being configured.
 * </p>
 */
public class ModelDescriptionParser {
	private static final Logger log = Logger.getLogger(ModelDescriptionParser.class);

	/** The default size of the chunks in which files are read */
	public static final int DEFAULT_BUFFER_SIZE = 1024;

	private Diagnostics theDiagnostics;
	private int theBufferSize;
	private int theStackCapacity;
	private boolean isStrictValidation;
	private AllocationTracker theTracker;

	/** Creates a parser with default settings, reporting diagnostics to log4j */
	public ModelDescriptionParser() {
		theDiagnostics = new Log4jDiagnostics();
		theBufferSize = DEFAULT_BUFFER_SIZE;
		theStackCapacity = NodeStack.DEFAULT_CAPACITY;
		theTracker = AllocationTracker.NONE;
	}

	/** @return The sink this parser reports progress and problems to */
	public Diagnostics getDiagnostics() {
		return theDiagnostics;
	}

	/**
	 * @param diagnostics The sink to report progress and problems to
	 * @return This parser
	 */
	public ModelDescriptionParser setDiagnostics(Diagnostics diagnostics) {
		if (diagnostics == null)
			throw new NullPointerException();
		theDiagnostics = diagnostics;
		return this;
	}

	/**
	 * @param bufferSize The size of the chunks in which files are read
	 * @return This parser
	 */
	public ModelDescriptionParser setBufferSize(int bufferSize) {
		if (bufferSize < 1)
			throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
		theBufferSize = bufferSize;
		return this;
	}

	/**
	 * @param stackCapacity The initial capacity of the node stack. The stack grows as needed.
	 * @return This parser
	 */
	public ModelDescriptionParser setStackCapacity(int stackCapacity) {
		if (stackCapacity < 1)
			throw new IllegalArgumentException("Stack capacity must be positive: " + stackCapacity);
		theStackCapacity = stackCapacity;
		return this;
	}

	/**
	 * @param strict Whether the validation after each parse should include the required-attribute and direct dependency checks
	 * @return This parser
	 * @see ModelDescriptionValidator
	 */
	public ModelDescriptionParser setStrictValidation(boolean strict) {
		isStrictValidation = strict;
		return this;
	}

	/**
	 * @param tracker The tracker to notify of every node created and released by parses
	 * @return This parser
	 */
	public ModelDescriptionParser setAllocationTracker(AllocationTracker tracker) {
		if (tracker == null)
			throw new NullPointerException();
		theTracker = tracker;
		return this;
	}

	/**
	 * @param file The modelDescription.xml file to parse
	 * @return The root of the parsed tree, which the caller must {@link ModelDescription#release() release}
	 * @throws IOException If the file cannot be opened or read
	 * @throws ModelDescriptionException If the file is not a valid model description
	 */
	public ModelDescription parse(Path file) throws IOException, ModelDescriptionException {
		InputStream in;
		try {
			in = Files.newInputStream(file);
		} catch (IOException e) {
			theDiagnostics.error("Cannot open file '" + file + "'");
			throw e;
		}
		try (InputStream buffered = new BufferedInputStream(in, theBufferSize)) {
			return parse(buffered, file.toString());
		}
	}

	/**
	 * @param in The stream containing the model description. The stream is not closed.
	 * @param sourceName The name of the document, for messages
	 * @return The root of the parsed tree, which the caller must {@link ModelDescription#release() release}
	 * @throws IOException If the stream cannot be read
	 * @throws ModelDescriptionException If the stream does not contain a valid model description
	 */
	public ModelDescription parse(InputStream in, String sourceName) throws IOException, ModelDescriptionException {
		theDiagnostics.info("parse " + sourceName);
		ModelDescriptionBuilder builder = new ModelDescriptionBuilder(theDiagnostics, theStackCapacity, theTracker);
		EventHandler handler = new EventHandler(builder, sourceName);
		ModelDescription md;
		try {
			createSAXParser().parse(in, handler);
			md = builder.finish();
		} catch (SAXException e) {
			builder.abort();
			ModelDescriptionException failure = handler.getFailure();
			if (failure != null) {
				theDiagnostics.fatal(failure.getDescription());
				throw failure;
			}
			int line = e instanceof SAXParseException ? ((SAXParseException) e).getLineNumber() : -1;
			int column = e instanceof SAXParseException ? ((SAXParseException) e).getColumnNumber() : -1;
			theDiagnostics.error("Parse error in file " + sourceName + " at line " + line + ":\n" + e.getMessage());
			throw new ModelDescriptionException(ErrorKind.MALFORMED_XML, e.getMessage(), new FilePosition(sourceName, line, column), e);
		} catch (ModelDescriptionException e) {
			builder.abort();
			theDiagnostics.fatal(e.getDescription());
			throw e;
		} catch (IOException e) {
			builder.abort();
			theDiagnostics.error("Cannot read file '" + sourceName + "': " + e.getMessage());
			throw e;
		} catch (RuntimeException e) {
			builder.abort();
			throw e;
		}

		int errors = new ModelDescriptionValidator(theDiagnostics, isStrictValidation).validate(md);
		if (errors > 0) {
			md.release();
			throw new ModelDescriptionException(ErrorKind.INVALID_REFERENCES, "Found " + errors + " error(s) in " + sourceName,
				new FilePosition(sourceName, -1, -1));
		}
		if (log.isDebugEnabled())
			log.debug("Parsed " + sourceName + ": " + (md.getModelVariables() == null ? 0 : md.getModelVariables().size()) + " variables");
		return md;
	}

	/**
	 * Like {@link #parse(Path)}, but for callers that only care whether the parse succeeded. The reason for a failure has already been
	 * reported to the diagnostics sink.
	 *
	 * @param file The modelDescription.xml file to parse
	 * @return The root of the parsed tree, which the caller must {@link ModelDescription#release() release}, or null if the parse failed
	 */
	public ModelDescription load(Path file) {
		try {
			return parse(file);
		} catch (IOException | ModelDescriptionException e) {
			log.debug("Could not load " + file, e);
			return null;
		}
	}

	private static SAXParser createSAXParser() {
		SAXParserFactory factory = SAXParserFactory.newInstance();
		factory.setNamespaceAware(false);
		factory.setValidating(false);
		try {
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
			return factory.newSAXParser();
		} catch (ParserConfigurationException | SAXException e) {
			throw new IllegalStateException("Can't create SAX parser", e);
		}
	}

	/**
	 * Feeds SAX events to a builder. A {@link ModelDescriptionException} from the builder is kept and wrapped in a {@link SAXException},
	 * which stops the SAX parser.
	 */
	private static class EventHandler extends DefaultHandler {
		private final ModelDescriptionBuilder theBuilder;
		private final String theSource;
		private Locator theLocator;
		private ModelDescriptionException theFailure;

		EventHandler(ModelDescriptionBuilder builder, String source) {
			theBuilder = builder;
			theSource = source;
			builder.withPosition(this::getPosition);
		}

		ModelDescriptionException getFailure() {
			return theFailure;
		}

		private FilePosition getPosition() {
			if (theLocator == null)
				return new FilePosition(theSource, -1, -1);
			return new FilePosition(theSource, theLocator.getLineNumber(), theLocator.getColumnNumber());
		}

		@Override
		public void setDocumentLocator(Locator locator) {
			theLocator = locator;
		}

		@Override
		public void startElement(String uri, String localName, String qName, Attributes attributes) throws SAXException {
			String[] flat = new String[attributes.getLength() * 2];
			for (int i = 0; i < attributes.getLength(); i++) {
				flat[i * 2] = attributes.getQName(i);
				flat[i * 2 + 1] = attributes.getValue(i);
			}
			try {
				theBuilder.startElement(qName, flat);
			} catch (ModelDescriptionException e) {
				throw fail(e);
			}
		}

		@Override
		public void endElement(String uri, String localName, String qName) throws SAXException {
			try {
				theBuilder.endElement(qName);
			} catch (ModelDescriptionException e) {
				throw fail(e);
			}
		}

		@Override
		public void characters(char[] ch, int start, int length) {
			theBuilder.characters(ch, start, length);
		}

		private SAXException fail(ModelDescriptionException e) {
			theFailure = e;
			return new SAXException(e.getMessage(), e);
		}
	}
}

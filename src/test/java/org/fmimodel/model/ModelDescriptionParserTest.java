package org.fmimodel.model;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.fmimodel.io.RecordingDiagnostics;
import org.fmimodel.io.Severity;
import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;
import org.fmimodel.vocab.EnumLiteral;
import org.hamcrest.CoreMatchers;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.primitives.UnsignedInteger;

/** Tests {@link ModelDescriptionParser} end to end against the XML documents in this package's test resources */
public class ModelDescriptionParserTest {
	/** Temporary directory for file-based tests */
	@Rule
	public TemporaryFolder theFolder = new TemporaryFolder();

	private RecordingDiagnostics theDiagnostics;
	private CountingTracker theTracker;
	private ModelDescriptionParser theParser;

	/** Creates a fresh parser for each test */
	@Before
	public void setUp() {
		theDiagnostics = new RecordingDiagnostics();
		theTracker = new CountingTracker();
		theParser = new ModelDescriptionParser().setDiagnostics(theDiagnostics).setAllocationTracker(theTracker).setStackCapacity(2);
	}

	private ModelDescription parseResource(String name) throws IOException, ModelDescriptionException {
		try (InputStream in = ModelDescriptionParserTest.class.getResourceAsStream(name)) {
			Assert.assertNotNull("Missing test resource " + name, in);
			return theParser.parse(in, name);
		}
	}

	private ModelDescriptionException expectFailure(String name) throws IOException {
		try {
			parseResource(name);
		} catch (ModelDescriptionException e) {
			theTracker.assertAllReleased();
			return e;
		}
		Assert.fail(name + " should have been rejected");
		return null;
	}

	private ModelDescriptionException expectFailure(String name, String xml) throws IOException {
		try {
			theParser.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), name);
		} catch (ModelDescriptionException e) {
			Assert.assertEquals(theTracker.getCreated(), theTracker.getReleased());
			return e;
		}
		Assert.fail(name + " should have been rejected");
		return null;
	}

	/**
	 * Tests a complete document
	 *
	 * @throws IOException If the test resource cannot be read
	 * @throws ModelDescriptionException If the document cannot be parsed
	 */
	@Test
	public void testVehicle() throws IOException, ModelDescriptionException {
		ModelDescription md = parseResource("vehicle.xml");
		Assert.assertEquals(Arrays.asList("parse vehicle.xml"), theDiagnostics.getMessages(Severity.INFO));
		Assert.assertTrue(theDiagnostics.getMessages(Severity.WARNING).isEmpty());

		Assert.assertEquals("vehicle", md.getModelIdentifier());
		Assert.assertEquals(UnsignedInteger.valueOf(2), md.getNumberOfContinuousStates());
		Assert.assertEquals(0, md.getNumberOfEventIndicators());
		Assert.assertEquals(AttributeValue.defined(EnumLiteral.STRUCTURED), md.getEnum(AttributeName.VARIABLE_NAMING_CONVENTION));
		Assert.assertEquals("{8c4e810f-3df3-4a00-8276-176fa3c9f000}", md.getString(AttributeName.GUID));

		Assert.assertEquals(2, md.getUnitDefinitions().size());
		Assert.assertEquals(1, md.getUnitDefinitions().get(0).getList().size());
		Assert.assertTrue(md.getUnitDefinitions().get(1).getList().isEmpty());
		Assert.assertEquals(2, md.getTypeDefinitions().size());
		Assert.assertEquals(AttributeValue.defined(1e-4), md.getDefaultExperiment().getDouble(AttributeName.TOLERANCE));
		Assert.assertEquals("Sim", md.getVendorAnnotations().get(0).getName());

		List<ScalarVariable> variables = md.getModelVariables();
		Assert.assertEquals(8, variables.size());
		Assert.assertEquals("speed", variables.get(0).getName());
		Assert.assertEquals("unused", variables.get(7).getName());

		CoSimulation cs = md.getCoSimulation();
		Assert.assertEquals(ElementKind.CO_SIMULATION_STAND_ALONE, cs.getKind());
		Assert.assertFalse(cs.isToolHosted());
		Assert.assertNull(cs.getModel());
		Assert.assertEquals(AttributeValue.defined(Boolean.TRUE),
			cs.getCapabilities().getBoolean(AttributeName.CAN_HANDLE_VARIABLE_COMMUNICATION_STEP_SIZE));

		md.release();
		theTracker.assertAllReleased();
	}

	/**
	 * Tests lookups and inheritance of attributes from declared types
	 *
	 * @throws IOException If the test resource cannot be read
	 * @throws ModelDescriptionException If the document cannot be parsed
	 */
	@Test
	public void testQueries() throws IOException, ModelDescriptionException {
		ModelDescription md = parseResource("vehicle.xml");
		UnsignedInteger vr0 = UnsignedInteger.ZERO;
		ScalarVariable speed = md.getVariableByName("speed");
		ScalarVariable position = md.getVariableByName("position");
		Assert.assertNull(md.getVariableByName("nothing"));

		// Real variable vr 0 of declared type Speed inherits the unit of the type
		Assert.assertEquals("m/s", md.getVariableAttributeString(vr0, ElementKind.REAL, AttributeName.UNIT));
		Assert.assertEquals(EnumLiteral.OUTPUT, speed.getCausality());
		Assert.assertEquals("Velocity", md.getInheritedString(speed.getTypeSpec(), AttributeName.QUANTITY));
		Assert.assertEquals("0", md.getInheritedString(speed.getTypeSpec(), AttributeName.START));
		Assert.assertNull(md.getInheritedString(speed.getTypeSpec(), AttributeName.MAX));
		// A local value overrides the declared type's
		ScalarVariable velocity = md.getVariableByName("velocity");
		Assert.assertEquals("km/h", md.getInheritedString(velocity.getTypeSpec(), AttributeName.UNIT));
		Assert.assertEquals(ValueStatus.MISSING, md.getInheritedDouble(position.getTypeSpec(), AttributeName.MIN).getStatus());
		Assert.assertEquals(AttributeValue.defined(0.0), md.getInheritedDouble(speed.getTypeSpec(), AttributeName.MIN));

		Assert.assertEquals("Speed over ground", md.getDescription(speed));
		Assert.assertEquals("Distance travelled", md.getDescription(position));
		Assert.assertNull(md.getDescription(md.getVariableByName("throttle")));

		Assert.assertEquals(20.0, md.getNominal(vr0), 0.0);
		Assert.assertEquals(1.0, md.getNominal(UnsignedInteger.ONE), 0.0);
		Assert.assertEquals(0.5, md.getNominal(UnsignedInteger.valueOf(2)), 0.0);
		// Illegal nominal
		Assert.assertEquals(1.0, md.getNominal(UnsignedInteger.valueOf(3)), 0.0);
		Assert.assertEquals(ValueStatus.ILLEGAL,
			md.getVariableAttributeDouble(UnsignedInteger.valueOf(3), ElementKind.REAL, AttributeName.NOMINAL).getStatus());
		Assert.assertEquals(ValueStatus.MISSING,
			md.getVariableAttributeDouble(UnsignedInteger.valueOf(99), ElementKind.REAL, AttributeName.NOMINAL).getStatus());

		// Lookup by value reference and base type
		Assert.assertSame(speed, md.getVariable(vr0, ElementKind.REAL));
		Assert.assertSame(speed, md.getNonAliasVariable(vr0, ElementKind.REAL));
		Assert.assertSame(md.getVariableByName("gear"), md.getVariable(vr0, ElementKind.INTEGER));
		Assert.assertSame(md.getVariableByName("count"), md.getVariable(UnsignedInteger.ONE, ElementKind.ENUMERATION));
		Assert.assertNull(md.getVariable(vr0, ElementKind.BOOLEAN));
		Assert.assertNull(md.getVariable(ScalarVariable.UNDEFINED_VALUE_REFERENCE, ElementKind.BOOLEAN));
		Assert.assertEquals(ScalarVariable.UNDEFINED_VALUE_REFERENCE, md.getVariableByName("unused").getValueReference());
		Assert.assertEquals(EnumLiteral.ALIAS, velocity.getAlias());

		Assert.assertEquals(AttributeValue.defined(2), md.getVariableByName("gear").getTypeSpec().getInt(AttributeName.START));
		Assert.assertEquals(ElementKind.ENUMERATION_TYPE, md.getDeclaredType("Gear").getTypeSpec().getKind());
		Assert.assertNull(md.getDeclaredType("Pressure"));
		Assert.assertNull(md.getDeclaredType(null));

		// Defaults
		Assert.assertEquals(EnumLiteral.INTERNAL, position.getCausality());
		Assert.assertEquals(EnumLiteral.CONTINUOUS, position.getVariability());
		Assert.assertEquals(EnumLiteral.NO_ALIAS, position.getAlias());
		Assert.assertEquals(ValueStatus.MISSING, position.getEnum(AttributeName.CAUSALITY).getStatus());
		Assert.assertEquals(EnumLiteral.DISCRETE, md.getVariableByName("gear").getVariability());

		ScalarVariable acceleration = md.getVariableByName("acceleration");
		Assert.assertEquals(Arrays.asList("throttle", "gear"), acceleration.getDirectDependencyNames());
		Assert.assertNull(speed.getDirectDependencies());

		// Attribute names are shared, not copied
		Assert.assertSame(speed.getAttributes().get(0).getName(), position.getAttributes().get(0).getName());
		Assert.assertSame(AttributeName.NAME, acceleration.getAttributes().get(0).getName());
		md.release();
	}

	/**
	 * Tests the difference between empty and absent blocks
	 *
	 * @throws IOException If the test resource cannot be read
	 * @throws ModelDescriptionException If the document cannot be parsed
	 */
	@Test
	public void testEmptyBlocks() throws IOException, ModelDescriptionException {
		ModelDescription md = parseResource("empty-blocks.xml");
		Assert.assertNotNull(md.getTypeDefinitions());
		Assert.assertTrue(md.getTypeDefinitions().isEmpty());
		Assert.assertNotNull(md.getModelVariables());
		Assert.assertTrue(md.getModelVariables().isEmpty());
		Assert.assertNull(md.getUnitDefinitions());
		Assert.assertNull(md.getDefaultExperiment());
		Assert.assertNull(md.getVendorAnnotations());
		Assert.assertNull(md.getCoSimulation());
		Assert.assertNull(md.getVariableByName("x"));
		Assert.assertNull(md.getVariable(UnsignedInteger.ZERO, ElementKind.REAL));
		Assert.assertTrue(md.getChildren().isEmpty());
		md.release();
		theTracker.assertAllReleased();
	}

	/**
	 * Tests a document written with the co-simulation block before the model variables
	 *
	 * @throws IOException If the test resource cannot be read
	 * @throws ModelDescriptionException If the document cannot be parsed
	 */
	@Test
	public void testMisplacedCoSimulation() throws IOException, ModelDescriptionException {
		ModelDescription md = parseResource("simulationx.xml");
		Assert.assertEquals(1, theDiagnostics.getMessages(Severity.WARNING).size());
		Assert.assertThat(theDiagnostics.getMessages(Severity.WARNING).get(0), CoreMatchers.containsString("SimulationX"));

		CoSimulation cs = md.getCoSimulation();
		Assert.assertTrue(cs.isToolHosted());
		Assert.assertEquals(AttributeValue.defined(Boolean.FALSE), cs.getModel().getBoolean(AttributeName.MANUAL_START));
		Assert.assertEquals(2, cs.getModel().getList().size());
		Assert.assertEquals("fmu://resources/tank.dat", cs.getModel().getList().get(1).getString(AttributeName.FILE));
		Assert.assertEquals(1, md.getModelVariables().size());
		// Canonical order, regardless of document order
		Assert.assertSame(cs, md.getChildren().get(md.getChildren().size() - 1));
		md.release();
		theTracker.assertAllReleased();
	}

	/**
	 * Tests that a variable of an undeclared type fails validation
	 *
	 * @throws IOException If the test resource cannot be read
	 */
	@Test
	public void testUnresolvedDeclaredType() throws IOException {
		ModelDescriptionException e = expectFailure("unresolved-type.xml");
		Assert.assertEquals(ErrorKind.INVALID_REFERENCES, e.getKind());
		Assert.assertEquals(Arrays.asList(//
			"Declared type Pressure of variable pressure not found in modelDescription.xml",
			"Declared type Temperature of variable temperature not found in modelDescription.xml"),
			theDiagnostics.getMessages(Severity.WARNING));
		Assert.assertEquals(Arrays.asList("Found 2 error(s) in modelDescription.xml"), theDiagnostics.getMessages(Severity.ERROR));
	}

	/**
	 * Tests a document which is not well-formed XML
	 *
	 * @throws IOException If the test resource cannot be read
	 */
	@Test
	public void testMalformed() throws IOException {
		ModelDescriptionException e = expectFailure("malformed.xml");
		Assert.assertEquals(ErrorKind.MALFORMED_XML, e.getKind());
		Assert.assertTrue(e.getPosition().getLineNumber() > 0);
		List<String> errors = theDiagnostics.getMessages(Severity.ERROR);
		Assert.assertEquals(1, errors.size());
		Assert.assertThat(errors.get(0), CoreMatchers.startsWith("Parse error in file malformed.xml at line "));
		Assert.assertTrue(theDiagnostics.getMessages(Severity.FATAL).isEmpty());
	}

	/**
	 * Tests rejection of names outside the vocabulary, with the position of the problem
	 *
	 * @throws IOException Not thrown
	 */
	@Test
	public void testUnknownNames() throws IOException {
		String header = "<?xml version=\"1.0\"?>\n<fmiModelDescription fmiVersion=\"1.0\">\n<ModelVariables>\n";
		ModelDescriptionException e = expectFailure("element.xml", header + "<Foo/>\n</ModelVariables>\n</fmiModelDescription>");
		Assert.assertEquals(ErrorKind.UNKNOWN_ELEMENT, e.getKind());
		Assert.assertEquals(4, e.getPosition().getLineNumber());
		Assert.assertEquals("element.xml", e.getPosition().getSource());
		List<String> fatal = theDiagnostics.getMessages(Severity.FATAL);
		Assert.assertEquals(1, fatal.size());
		Assert.assertThat(fatal.get(0), CoreMatchers.startsWith("element.xml:L4"));
		Assert.assertThat(fatal.get(0), CoreMatchers.endsWith("Illegal element Foo"));

		e = expectFailure("attribute.xml", header + "<ScalarVariable name=\"x\" valueReference=\"0\" color=\"red\"><Real/></ScalarVariable>\n"
			+ "</ModelVariables>\n</fmiModelDescription>");
		Assert.assertEquals(ErrorKind.UNKNOWN_ATTRIBUTE, e.getKind());

		e = expectFailure("enum.xml", header + "<ScalarVariable name=\"x\" valueReference=\"0\" causality=\"sideways\"><Real/></ScalarVariable>\n"
			+ "</ModelVariables>\n</fmiModelDescription>");
		Assert.assertEquals(ErrorKind.UNKNOWN_ENUM_VALUE, e.getKind());
		Assert.assertThat(e.getMessage(), CoreMatchers.containsString("sideways"));

		// Namespace declarations are attributes like any other
		e = expectFailure("namespace.xml", "<fmiModelDescription xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\" fmiVersion=\"1.0\"/>");
		Assert.assertEquals(ErrorKind.UNKNOWN_ATTRIBUTE, e.getKind());
		theTracker.assertAllReleased();
	}

	/**
	 * Tests elements in the wrong place
	 *
	 * @throws IOException Not thrown
	 */
	@Test
	public void testWrongStructure() throws IOException {
		ModelDescriptionException e = expectFailure("wrong.xml", "<fmiModelDescription><ModelVariables>"
			+ "<ScalarVariable name=\"x\" valueReference=\"0\"><Real/><DirectDependency><Name>u</Name><Item/></DirectDependency>"
			+ "</ScalarVariable></ModelVariables></fmiModelDescription>");
		Assert.assertEquals(ErrorKind.WRONG_ELEMENT_TYPE, e.getKind());
		Assert.assertEquals("Wrong element type, expected DirectDependency, found Item", e.getMessage());

		e = expectFailure("duplicate.xml", "<fmiModelDescription><TypeDefinitions/><TypeDefinitions/></fmiModelDescription>");
		Assert.assertEquals(ErrorKind.DUPLICATE_BLOCK, e.getKind());

		e = expectFailure("root.xml", "<ModelVariables/>");
		Assert.assertEquals(ErrorKind.WRONG_ELEMENT_TYPE, e.getKind());

		e = expectFailure("doctype.xml", "<!DOCTYPE fmiModelDescription [<!ENTITY x \"y\">]><fmiModelDescription/>");
		Assert.assertEquals(ErrorKind.MALFORMED_XML, e.getKind());
		theTracker.assertAllReleased();
	}

	/**
	 * Tests that strict validation is off unless requested
	 *
	 * @throws IOException If the test resource cannot be read
	 * @throws ModelDescriptionException If the document cannot be parsed without strict validation
	 */
	@Test
	public void testStrictValidation() throws IOException, ModelDescriptionException {
		parseResource("loose.xml").release();
		Assert.assertTrue(theDiagnostics.getMessages(Severity.WARNING).isEmpty());

		theParser.setStrictValidation(true);
		ModelDescriptionException e = expectFailure("loose.xml");
		Assert.assertEquals(ErrorKind.INVALID_REFERENCES, e.getKind());
		Assert.assertEquals(Arrays.asList("Found 6 error(s) in modelDescription.xml"), theDiagnostics.getMessages(Severity.ERROR));

		parseResource("vehicle.xml").release();
		theTracker.assertAllReleased();
	}

	/**
	 * Tests parsing from a file
	 *
	 * @throws IOException If the file cannot be written or read
	 * @throws ModelDescriptionException If the document cannot be parsed
	 */
	@Test
	public void testFile() throws IOException, ModelDescriptionException {
		Path file = theFolder.getRoot().toPath().resolve("modelDescription.xml");
		try (InputStream in = ModelDescriptionParserTest.class.getResourceAsStream("vehicle.xml")) {
			Files.copy(in, file);
		}
		ModelDescription md = theParser.setBufferSize(16).parse(file);
		Assert.assertEquals(8, md.getModelVariables().size());
		md.release();

		md = theParser.load(file);
		Assert.assertNotNull(md);
		md.release();
		theTracker.assertAllReleased();
		Assert.assertEquals(Arrays.asList("parse " + file, "parse " + file), theDiagnostics.getMessages(Severity.INFO));

		Path missing = theFolder.getRoot().toPath().resolve("missing.xml");
		try {
			theParser.parse(missing);
			Assert.fail("File does not exist");
		} catch (IOException e) {
		}
		Assert.assertEquals(Arrays.asList("Cannot open file '" + missing + "'"), theDiagnostics.getMessages(Severity.ERROR));
		Assert.assertNull(theParser.load(missing));
	}

	/**
	 * Tests that a failure reading an opened file is reported
	 *
	 * @throws IOException If the directory cannot be created
	 */
	@Test
	public void testUnreadableFile() throws IOException {
		Path directory = theFolder.newFolder("modelDescription.xml").toPath();
		Assert.assertNull(theParser.load(directory));
		Assert.assertEquals(1, theDiagnostics.getMessages(Severity.ERROR).size());
		Assert.assertThat(theDiagnostics.getMessages(Severity.ERROR).get(0),
			CoreMatchers.startsWith("Cannot read file '" + directory + "'"));
		theTracker.assertAllReleased();
	}

	/**
	 * Tests strict validation of direct dependencies whose names are indented in the document
	 *
	 * @throws IOException Not thrown
	 * @throws ModelDescriptionException If the document is rejected
	 */
	@Test
	public void testIndentedDependencyName() throws IOException, ModelDescriptionException {
		String xml = "<fmiModelDescription fmiVersion=\"1.0\" modelName=\"m\" modelIdentifier=\"m\" guid=\"g\""
			+ " numberOfContinuousStates=\"0\" numberOfEventIndicators=\"0\">\n"//
			+ "  <ModelVariables>\n"//
			+ "    <ScalarVariable name=\"u\" valueReference=\"0\" causality=\"input\"><Real/></ScalarVariable>\n"//
			+ "    <ScalarVariable name=\"y\" valueReference=\"1\" causality=\"output\">\n"//
			+ "      <Real/>\n"//
			+ "      <DirectDependency>\n"//
			+ "        <Name>\n"//
			+ "          u\n"//
			+ "        </Name>\n"//
			+ "      </DirectDependency>\n"//
			+ "    </ScalarVariable>\n"//
			+ "  </ModelVariables>\n"//
			+ "</fmiModelDescription>\n";
		ModelDescription md = theParser.setStrictValidation(true)
			.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "indented.xml");
		Assert.assertTrue(theDiagnostics.getMessages(Severity.WARNING).isEmpty());
		Assert.assertTrue(theDiagnostics.getMessages(Severity.ERROR).isEmpty());
		Assert.assertEquals("u", md.getVariableByName("y").getDirectDependencyNames().get(0).trim());
		md.release();
		theTracker.assertAllReleased();
	}
}

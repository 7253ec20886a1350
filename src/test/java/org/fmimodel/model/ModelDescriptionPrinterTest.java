package org.fmimodel.model;

import org.fmimodel.io.Diagnostics;
import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

/** Tests {@link ModelDescriptionPrinter} */
public class ModelDescriptionPrinterTest {
	/** Tests printing a small tree */
	@Test
	public void testPrint() throws ModelDescriptionException {
		ModelDescriptionBuilder builder = new ModelDescriptionBuilder(Diagnostics.NONE, 10, AllocationTracker.NONE);
		builder.startElement("fmiModelDescription", "fmiVersion", "1.0", "modelIdentifier", "m");
		builder.startElement("ModelVariables");
		builder.startElement("ScalarVariable", "name", "x", "valueReference", "0");
		builder.startElement("Real", "start", "1.5");
		builder.endElement("Real");
		builder.endElement("ScalarVariable");
		builder.endElement("ModelVariables");
		builder.startElement("TypeDefinitions");
		builder.endElement("TypeDefinitions");
		builder.endElement("fmiModelDescription");
		ModelDescription md = builder.finish();

		Assert.assertEquals("fmiModelDescription fmiVersion=1.0 modelIdentifier=m\n"//
			+ "  ScalarVariable name=x valueReference=0\n"//
			+ "    Real start=1.5\n", new ModelDescriptionPrinter().print(md));
		StringBuilder tabbed = new StringBuilder();
		new ModelDescriptionPrinter(1).print(md.getModelVariables().get(0), tabbed);
		Assert.assertEquals("ScalarVariable name=x valueReference=0\n Real start=1.5\n", tabbed.toString());
		md.release();
	}

	/** Tests printing a single node */
	@Test
	public void testLeaf() {
		ModelElement item = ModelElement.create(ElementKind.ITEM,
			ImmutableList.of(new Attribute(AttributeName.NAME, "drive"), new Attribute(AttributeName.DESCRIPTION, "Forward")),
			AllocationTracker.NONE);
		Assert.assertEquals("Item name=drive description=Forward\n", new ModelDescriptionPrinter().print(item));
	}
}

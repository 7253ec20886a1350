package org.fmimodel.model;

import java.util.List;

import org.apache.log4j.Logger;
import org.fmimodel.io.Diagnostics;
import org.fmimodel.vocab.AttributeName;
import org.fmimodel.vocab.ElementKind;
import org.fmimodel.vocab.EnumLiteral;

/**
 * <p>
 * Checks the references of a parsed model description which the tree builder cannot check while the document is still being read.
 * </p>
 * <p>
 * By default the only check is that every declaredType of a variable names a Type of the document. In strict mode the validator also
 * checks that the attributes the schema requires are present and that direct dependencies are declared only on outputs and name only
 * inputs of the model.
 * </p>
 * <p>
 * Each problem is reported to the diagnostics sink as a warning and counted. The tree is never modified.
 * </p>
 */
public class ModelDescriptionValidator {
	private static final Logger log = Logger.getLogger(ModelDescriptionValidator.class);

	private final Diagnostics theDiagnostics;
	private final boolean isStrict;
	private int theErrorCount;

	/**
	 * @param diagnostics The sink to report problems to
	 * @param strict Whether to perform the required-attribute and direct dependency checks in addition to the declared type check
	 */
	public ModelDescriptionValidator(Diagnostics diagnostics, boolean strict) {
		theDiagnostics = diagnostics;
		isStrict = strict;
	}

	/** @return Whether this validator performs the strict checks */
	public boolean isStrict() {
		return isStrict;
	}

	/**
	 * @param md The model description to validate
	 * @return The number of errors found. If non-zero, an error summarizing the count has been reported.
	 */
	public int validate(ModelDescription md) {
		theErrorCount = 0;
		if (isStrict)
			checkRoot(md);
		if (md.getModelVariables() != null) {
			for (ScalarVariable variable : md.getModelVariables())
				checkVariable(md, variable);
		}
		if (isStrict) {
			if (md.getTypeDefinitions() != null) {
				for (TypeDefinition type : md.getTypeDefinitions())
					checkType(type);
			}
			if (md.getVendorAnnotations() != null) {
				for (ListElement tool : md.getVendorAnnotations())
					checkTool(tool);
			}
		}
		if (theErrorCount > 0)
			theDiagnostics.error("Found " + theErrorCount + " error(s) in modelDescription.xml");
		else if (log.isDebugEnabled())
			log.debug("modelDescription.xml " + (isStrict ? "strictly " : "") + "validated");
		return theErrorCount;
	}

	private void checkVariable(ModelDescription md, ScalarVariable variable) {
		String declaredType = variable.getDeclaredTypeName();
		if (declaredType != null && md.getDeclaredType(declaredType) == null) {
			problem("Declared type " + declaredType + " of variable " + variable.getString(AttributeName.NAME)
				+ " not found in modelDescription.xml");
		}
		if (!isStrict)
			return;
		checkRequired(variable, AttributeName.NAME);
		if (!checkRequired(variable, AttributeName.VALUE_REFERENCE))
			return;
		if (!variable.getUInt(AttributeName.VALUE_REFERENCE).isDefined())
			problem("Illegal valueReference " + variable.getString(AttributeName.VALUE_REFERENCE) + " of variable " + describe(variable));
		List<String> dependencies = variable.getDirectDependencyNames();
		if (dependencies == null)
			return;
		if (variable.getCausality() != EnumLiteral.OUTPUT)
			problem("Direct dependencies declared for variable " + describe(variable) + ", which is not an output");
		for (String text : dependencies) {
			// Name content is kept as written, so indented content is trimmed for the lookup
			String input = text.trim();
			ScalarVariable dependency = md.getVariableByName(input);
			if (dependency == null)
				problem("Direct dependency " + input + " of variable " + describe(variable) + " not found in modelDescription.xml");
			else if (dependency.getCausality() != EnumLiteral.INPUT)
				problem("Direct dependency " + input + " of variable " + describe(variable) + " is not an input");
		}
	}

	private void checkRoot(ModelDescription md) {
		checkRequired(md, AttributeName.FMI_VERSION);
		checkRequired(md, AttributeName.MODEL_NAME);
		checkRequired(md, AttributeName.MODEL_IDENTIFIER);
		checkRequired(md, AttributeName.GUID);
		if (checkRequired(md, AttributeName.NUMBER_OF_CONTINUOUS_STATES)
			&& !md.getUInt(AttributeName.NUMBER_OF_CONTINUOUS_STATES).isDefined())
			problem("Illegal numberOfContinuousStates " + md.getString(AttributeName.NUMBER_OF_CONTINUOUS_STATES));
		if (checkRequired(md, AttributeName.NUMBER_OF_EVENT_INDICATORS)
			&& !md.getInt(AttributeName.NUMBER_OF_EVENT_INDICATORS).isDefined())
			problem("Illegal numberOfEventIndicators " + md.getString(AttributeName.NUMBER_OF_EVENT_INDICATORS));
	}

	private void checkType(TypeDefinition type) {
		checkRequired(type, AttributeName.NAME);
		ModelElement typeSpec = type.getTypeSpec();
		if (typeSpec != null && typeSpec.getKind() == ElementKind.ENUMERATION_TYPE) {
			for (ModelElement item : ((ListElement) typeSpec).getList())
				checkRequired(item, AttributeName.NAME);
		}
	}

	private void checkTool(ListElement tool) {
		checkRequired(tool, AttributeName.NAME);
		for (ModelElement annotation : tool.getList())
			checkRequired(annotation, AttributeName.NAME);
	}

	private boolean checkRequired(ModelElement element, AttributeName name) {
		if (element.getString(name) != null)
			return true;
		problem("Required attribute " + name + " missing from " + describe(element));
		return false;
	}

	private static String describe(ModelElement element) {
		String name = element.getString(AttributeName.NAME);
		return name == null ? element.getKind().getXmlName() : element.getKind() + " " + name;
	}

	private void problem(String message) {
		theErrorCount++;
		theDiagnostics.warn(message);
	}
}

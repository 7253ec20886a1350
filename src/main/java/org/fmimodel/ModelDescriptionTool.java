package org.fmimodel;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Logger;
import org.fmimodel.model.ModelDescription;
import org.fmimodel.model.ModelDescriptionParser;
import org.fmimodel.model.ModelDescriptionPrinter;

/**
 * Command line entry point. Parses a modelDescription.xml file and prints its syntax tree.
 *
 * <pre>
 * ModelDescriptionTool [--strict] &lt;modelDescription.xml&gt;
 * </pre>
 */
public class ModelDescriptionTool {
	/** The usage message printed for wrong arguments */
	public static final String USAGE = "Usage: ModelDescriptionTool [--strict] <modelDescription.xml>";

	/**
	 * @param args The command line arguments
	 */
	public static void main(String... args) {
		if (!Logger.getRootLogger().getAllAppenders().hasMoreElements())
			BasicConfigurator.configure();
		System.exit(run(args, System.out, new ModelDescriptionParser()));
	}

	/**
	 * @param args The command line arguments
	 * @param out The stream to print the tree or the usage message to
	 * @param parser The parser to parse the file with
	 * @return The exit status: 0 if the file was parsed, 1 if it was not, 2 for wrong usage
	 */
	public static int run(String[] args, PrintStream out, ModelDescriptionParser parser) {
		boolean strict = false;
		String file = null;
		for (String arg : args) {
			if (arg.equals("--strict"))
				strict = true;
			else if (arg.startsWith("-") || file != null) {
				out.println(USAGE);
				return 2;
			} else
				file = arg;
		}
		if (file == null) {
			out.println(USAGE);
			return 2;
		}

		Path path = Paths.get(file);
		ModelDescription md = parser.setStrictValidation(strict).load(path);
		if (md == null)
			return 1;
		try {
			out.print(new ModelDescriptionPrinter().print(md));
		} finally {
			md.release();
		}
		return 0;
	}
}

package edu.upf.taln.tted.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import edu.upf.taln.tted.core.Options;
import edu.upf.taln.tted.core.io.TextTreeReader;
import edu.upf.taln.tted.core.structures.TextTree;
import edu.upf.taln.tted.tools.evaluation.FolderEvaluation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;

public class Driver
{
	private static final String compare_command = "compare";
	private static final String average_command = "average";
	private static final String evaluate_command = "evaluate";
	private final static Logger log = LogManager.getLogger();

	private static abstract class BaseCommand
	{
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file. If not set, config.properties is read from the classpath", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path properties;
		@Parameter(names = {"-u", "-unordered"}, description = "If true, order of siblings is ignored", arity = 1)
		protected boolean unordered = true;
		@Parameter(names = {"-c", "-context"}, description = "If true, labels are prefixed with the labels of their ancestors", arity = 1)
		protected boolean context = false;
		@Parameter(names = {"-d", "-depth"}, description = "Maximum depth of the trees to compare", arity = 1,
				converter = CMLCheckers.PositiveIntegerConverter.class)
		protected Integer depth = null;

		Options toOptions()
		{
			final Options options = new Options();
			options.unordered = unordered;
			options.use_context = context;
			options.depth_limit = depth;
			return options;
		}
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Compute the tree edit distance between two trees")
	private static class CompareCommand extends BaseCommand
	{
		@Parameter(names = {"-t1", "-tree1"}, description = "Path to JSON file with the first tree", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path tree1;
		@Parameter(names = {"-t2", "-tree2"}, description = "Path to JSON file with the second tree", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path tree2;
		@Parameter(names = {"-n", "-normalize"}, description = "If true, the distance is normalized to [0,1)", arity = 1)
		private boolean normalize = false;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Compute the depth-averaged normalized distance between two trees")
	private static class AverageCommand extends BaseCommand
	{
		@Parameter(names = {"-t1", "-tree1"}, description = "Path to JSON file with the first tree", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path tree1;
		@Parameter(names = {"-t2", "-tree2"}, description = "Path to JSON file with the second tree", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path tree2;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Compare generated trees against reference trees with the same file names")
	private static class EvaluateCommand extends BaseCommand
	{
		@Parameter(names = {"-g", "-generated"}, description = "Path to folder containing generated trees", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFolder.class)
		private Path generated;
		@Parameter(names = {"-r", "-reference"}, description = "Path to folder containing reference trees", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFolder.class)
		private Path reference;
		@Parameter(names = {"-o", "-output"}, description = "Path to tab-separated report file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path output;
		@Parameter(names = {"-a", "-averaged"}, description = "If true, the depth-averaged distance is computed", arity = 1)
		private boolean averaged = true;
		@Parameter(names = {"-n", "-normalize"}, description = "If true, non-averaged distances are normalized", arity = 1)
		private boolean normalize = true;
		@Parameter(names = {"-parallel"}, description = "If true, pairs of trees are compared concurrently", arity = 1)
		private boolean parallel = false;
	}

	public static void main(String[] args) throws Exception
	{
		CompareCommand compare = new CompareCommand();
		AverageCommand average = new AverageCommand();
		EvaluateCommand evaluate = new EvaluateCommand();

		JCommander jc = new JCommander();
		jc.addCommand(compare_command, compare);
		jc.addCommand(average_command, average);
		jc.addCommand(evaluate_command, evaluate);
		jc.parse(args);

		if (jc.getParsedCommand() == null)
		{
			jc.usage();
			return;
		}

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		Date date = new Date();
		log.info(dateFormat.format(date) + " running \n\t" + String.join("\n\t", args));
		log.info("\n*********************************************************");

		switch (jc.getParsedCommand())
		{
			case compare_command:
			{
				MetricResourcesFactory resources = new MetricResourcesFactory(loadProperties(compare));
				Options options = compare.toOptions();
				options.normalize = compare.normalize;
				TextTree tree1 = TextTreeReader.read(compare.tree1);
				TextTree tree2 = TextTreeReader.read(compare.tree2);
				double distance = resources.getTreeDistance().compare(tree1, tree2, options);
				log.info("Distance = " + distance);
				System.out.println(distance);
				break;
			}
			case average_command:
			{
				MetricResourcesFactory resources = new MetricResourcesFactory(loadProperties(average));
				TextTree tree1 = TextTreeReader.read(average.tree1);
				TextTree tree2 = TextTreeReader.read(average.tree2);
				double distance = resources.getAveragedTreeDistance().compare(tree1, tree2, average.toOptions());
				log.info("Averaged distance = " + distance);
				System.out.println(distance);
				break;
			}
			case evaluate_command:
			{
				MetricResourcesFactory resources = new MetricResourcesFactory(loadProperties(evaluate));
				Options options = evaluate.toOptions();
				options.normalize = evaluate.normalize;
				options.parallel = evaluate.parallel;
				FolderEvaluation.run(evaluate.generated, evaluate.reference, evaluate.output,
						resources.getTreeDistance(), evaluate.averaged, options);
				break;
			}
		}
	}

	private static MetricProperties loadProperties(BaseCommand command) throws IOException
	{
		return command.properties == null ? new MetricProperties() : new MetricProperties(command.properties);
	}
}

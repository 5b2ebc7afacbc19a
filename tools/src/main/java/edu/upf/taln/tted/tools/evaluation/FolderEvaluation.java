package edu.upf.taln.tted.tools.evaluation;

import com.google.common.base.Stopwatch;
import edu.upf.taln.tted.core.Options;
import edu.upf.taln.tted.core.io.TextTreeReader;
import edu.upf.taln.tted.core.metric.AveragedTreeDistance;
import edu.upf.taln.tted.core.metric.TreeDistance;
import edu.upf.taln.tted.core.structures.TextTree;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

/**
 * Compares generated trees against reference trees stored as JSON files with the same name in two folders.
 * References without a generated counterpart are skipped with a warning.
 */
public class FolderEvaluation
{
	private static final String extension = ".json";
	private final static Logger log = LogManager.getLogger();

	/**
	 * @param averaged if true, the depth-averaged distance is computed for each pair, otherwise the plain distance
	 * @param output   if not null, a tab-separated report with one line per file and a final mean is written to it
	 * @return distance of each pair, keyed by file name and sorted by it
	 */
	public static Map<String, Double> run(Path generated, Path reference, Path output, TreeDistance metric,
	                                      boolean averaged, Options options) throws IOException
	{
		log.info("***\n" + options + "\n***");
		final Stopwatch timer = Stopwatch.createStarted();

		final List<Path> reference_files;
		try (Stream<Path> files = Files.list(reference))
		{
			reference_files = files
					.filter(f -> f.getFileName().toString().endsWith(extension))
					.sorted()
					.collect(toList());
		}

		final List<Pair<Path, Path>> pairs = new ArrayList<>();
		for (Path reference_file : reference_files)
		{
			final Path generated_file = generated.resolve(reference_file.getFileName().toString());
			if (Files.isRegularFile(generated_file))
				pairs.add(Pair.of(generated_file, reference_file));
			else
				log.warn("No generated tree for " + reference_file.getFileName());
		}
		log.info("Evaluating " + pairs.size() + " pairs of trees");

		final AveragedTreeDistance averaged_metric = new AveragedTreeDistance(metric);
		Stream<Pair<Path, Path>> stream = pairs.stream();
		if (options.parallel)
			stream = stream.parallel();

		final List<Pair<String, Double>> scores = stream
				.map(p ->
				{
					final TextTree generated_tree = read(p.getLeft());
					final TextTree reference_tree = read(p.getRight());
					final double score = averaged ?
							averaged_metric.compare(generated_tree, reference_tree, options) :
							metric.compare(generated_tree, reference_tree, options);
					log.info(p.getRight().getFileName() + "\t" + score);
					return Pair.of(p.getRight().getFileName().toString(), score);
				})
				.collect(toList());

		final Map<String, Double> results = new LinkedHashMap<>();
		scores.forEach(p -> results.put(p.getLeft(), p.getRight()));
		final double mean = results.values().stream()
				.mapToDouble(Double::doubleValue)
				.average().orElse(0.0);
		log.info("Mean distance over " + results.size() + " pairs: " + mean);
		log.info("Evaluation took " + timer.stop());

		if (output != null)
		{
			final List<String> lines = new ArrayList<>();
			lines.add("file\tdistance");
			results.forEach((f, s) -> lines.add(f + "\t" + s));
			lines.add("mean\t" + mean);
			FileUtils.writeLines(output.toFile(), StandardCharsets.UTF_8.name(), lines);
			log.info("Report written to " + output);
		}

		return results;
	}

	private static TextTree read(Path file)
	{
		try
		{
			return TextTreeReader.read(file);
		}
		catch (IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}
}

package edu.upf.taln.tted.core.similarity.vectors;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Word vectors read into memory from a text file with one item per line followed by its space-separated values.
 */
public class TextVectors extends Vectors
{
	private final Map<String, double[]> vectors;
	private final int num_dimensions;
	private final static Logger log = LogManager.getLogger();

	public TextVectors(Path vectors_path, VectorType vectorType) throws IOException
	{
		log.info("Loading vectors from " + vectors_path);
		Stopwatch timer = Stopwatch.createStarted();
		vectors = readVectorsFromFile(vectors_path, vectorType);
		num_dimensions = vectors.isEmpty() ? 0 : vectors.values().iterator().next().length;
		log.info("Loading took " + timer.stop());
	}

	public TextVectors(Map<String, double[]> vectors)
	{
		this.vectors = new HashMap<>(vectors);
		num_dimensions = vectors.isEmpty() ? 0 : vectors.values().iterator().next().length;
	}

	@Override
	public boolean isDefinedFor(String item)
	{
		return vectors.containsKey(item);
	}

	@Override
	public Optional<double[]> getVector(String item)
	{
		final Optional<double[]> v = Optional.ofNullable(vectors.get(item));
		if (v.isPresent())
			return v;
		else
			return getUnknownVector((i) -> Optional.ofNullable(vectors.get(i)));
	}

	@Override
	public int getNumDimensions()
	{
		return num_dimensions;
	}

	/**
	 * Reads a text file containing distributional vectors. Lines with a wrong number of values are skipped.
	 */
	public static Map<String, double[]> readVectorsFromFile(Path vectors_file, VectorType vectorType) throws IOException
	{
		int num_dimensions = -1;
		int line_counter = 0;
		final Map<String, double[]> vectors = new HashMap<>();

		try (BufferedReader br = Files.newBufferedReader(vectors_file, StandardCharsets.UTF_8))
		{
			String line;
			while ((line = br.readLine()) != null)
			{
				++line_counter;
				final String[] columns = line.trim().split(" ");
				if (num_dimensions == -1)
				{
					if (vectorType == VectorType.Text_Glove)
					{
						// header line: number of vectors and number of dimensions
						if (columns.length < 2)
							throw new IOException("Invalid header in line " + line_counter + " of " + vectors_file +
									", expected number of vectors and number of dimensions: \"" + line + "\"");
						try
						{
							num_dimensions = Integer.parseInt(columns[1]);
						}
						catch (NumberFormatException e)
						{
							throw new IOException("Invalid number of dimensions in line " + line_counter + " of " + vectors_file, e);
						}
						if (num_dimensions < 1)
							throw new IOException("Invalid number of dimensions in line " + line_counter + " of " + vectors_file +
									": " + num_dimensions);
						continue;
					}
					num_dimensions = columns.length - 1;
				}

				if (columns.length != num_dimensions + 1)
				{
					log.warn("Cannot parse line " + line_counter + ": \"" + line + "\"");
					continue;
				}

				// For performance reasons, let's avoid regular expressions
				final String item = columns[0];
				final double[] vector = new double[num_dimensions];
				for (int i = 0; i < num_dimensions; ++i)
				{
					try
					{
						vector[i] = Double.parseDouble(columns[i + 1]);
					}
					catch (NumberFormatException e)
					{
						throw new IOException("Invalid value in line " + line_counter + " of " + vectors_file, e);
					}
				}

				if (vectors.containsKey(item))
					log.warn("Duplicate key " + item);
				vectors.put(item, vector);
			}
		}
		log.info("Parsing complete: " + vectors.size() + " vectors read from " + line_counter + " lines");

		return vectors;
	}
}

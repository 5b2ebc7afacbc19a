package edu.upf.taln.tted.tools;

import com.google.common.base.Enums;
import edu.upf.taln.tted.core.similarity.vectors.Vectors.VectorType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings of the resources used by the metric: word vectors and embedding distance.
 * Read from a properties file, or from config.properties in the classpath.
 */
public class MetricProperties
{
	public enum DistanceType {Cosine, Euclidean}

	private final Path vectorsPath;
	private final VectorType vectorsType;
	private final DistanceType distanceType;

	private final static Logger log = LogManager.getLogger();

	public MetricProperties() throws IOException
	{
		this(loadFromClasspath());
	}

	public MetricProperties(Path properties_file) throws IOException
	{
		this(loadFromFile(properties_file));
	}

	MetricProperties(Properties prop)
	{
		vectorsPath = checkValidFile(prop.getProperty("tted.vectors.path"));
		vectorsType = Enums.getIfPresent(VectorType.class, prop.getProperty("tted.vectors.type", "")).or(VectorType.Text_Word2vec);
		distanceType = Enums.getIfPresent(DistanceType.class, prop.getProperty("tted.distance", "")).or(DistanceType.Cosine);
		log.info("Vectors " + vectorsPath + " (" + vectorsType + "), distance " + distanceType);
	}

	public Path getVectorsPath()
	{
		return vectorsPath;
	}

	public VectorType getVectorsType()
	{
		return vectorsType;
	}

	public DistanceType getDistanceType()
	{
		return distanceType;
	}

	private static Properties loadFromClasspath() throws IOException
	{
		final Properties prop = new Properties();
		try (InputStream input = MetricProperties.class.getClassLoader().getResourceAsStream("config.properties"))
		{
			if (input == null)
				throw new IOException("Unable to find config.properties in the classpath");
			prop.load(input);
		}
		return prop;
	}

	private static Properties loadFromFile(Path properties_file) throws IOException
	{
		final Properties prop = new Properties();
		try (Reader reader = Files.newBufferedReader(properties_file, StandardCharsets.UTF_8))
		{
			prop.load(reader);
		}
		return prop;
	}

	private static Path checkValidFile(String value)
	{
		if (value == null || value.isBlank())
			throw new RuntimeException("Missing property tted.vectors.path");
		final Path path = Paths.get(value);
		if (!Files.exists(path) || !Files.isRegularFile(path))
			throw new RuntimeException(value + " is not a valid path");
		return path;
	}
}

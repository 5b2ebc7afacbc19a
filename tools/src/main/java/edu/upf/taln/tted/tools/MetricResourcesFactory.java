package edu.upf.taln.tted.tools;

import edu.upf.taln.tted.core.metric.AveragedTreeDistance;
import edu.upf.taln.tted.core.metric.TreeDistance;
import edu.upf.taln.tted.core.similarity.CosineDistance;
import edu.upf.taln.tted.core.similarity.EmbeddingDistance;
import edu.upf.taln.tted.core.similarity.EuclideanDistance;
import edu.upf.taln.tted.core.similarity.SentenceEncoder;
import edu.upf.taln.tted.core.similarity.vectors.TextVectors;
import edu.upf.taln.tted.core.similarity.vectors.VectorsSentenceEncoder;

import java.io.IOException;

/**
 * Creates the encoder and distance function described by a set of properties. Vectors are loaded once.
 */
public class MetricResourcesFactory
{
	private final SentenceEncoder encoder;
	private final EmbeddingDistance distance;

	public MetricResourcesFactory(MetricProperties properties) throws IOException
	{
		this(new VectorsSentenceEncoder(new TextVectors(properties.getVectorsPath(), properties.getVectorsType())),
				createDistance(properties.getDistanceType()));
	}

	public MetricResourcesFactory(SentenceEncoder encoder, EmbeddingDistance distance)
	{
		this.encoder = encoder;
		this.distance = distance;
	}

	public SentenceEncoder getEncoder() { return encoder; }
	public EmbeddingDistance getDistance() { return distance; }
	public TreeDistance getTreeDistance() { return new TreeDistance(encoder, distance); }
	public AveragedTreeDistance getAveragedTreeDistance() { return new AveragedTreeDistance(getTreeDistance()); }

	public static EmbeddingDistance createDistance(MetricProperties.DistanceType type)
	{
		switch (type)
		{
			case Euclidean:
				return new EuclideanDistance();
			case Cosine:
			default:
				return new CosineDistance();
		}
	}
}

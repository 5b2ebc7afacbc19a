package edu.upf.taln.tted.core.similarity;

/**
 * One minus the cosine similarity of two vectors, in the range [0, 2].
 * A zero vector is at distance 1 from any other vector and at distance 0 from another zero vector.
 */
public class CosineDistance implements EmbeddingDistance
{
	@Override
	public double apply(double[] v1, double[] v2)
	{
		double dotProduct = 0.0;
		double normA = 0.0;
		double normB = 0.0;
		for (int i = 0; i < v1.length; i++)
		{
			dotProduct += v1[i] * v2[i];
			normA += Math.pow(v1[i], 2);
			normB += Math.pow(v2[i], 2);
		}

		// prevent NaNs
		if (normA == 0.0 && normB == 0.0)
			return 0.0;
		if (normA == 0.0 || normB == 0.0)
			return 1.0;

		double magnitude = Math.sqrt(normA) * Math.sqrt(normB);

		// correct for floating-point rounding errors
		magnitude = Math.max(magnitude, Math.abs(dotProduct));

		return Math.max(0.0, 1.0 - dotProduct / magnitude);
	}
}

package edu.upf.taln.tted.core.similarity;

/**
 * Nonnegative distance between two embeddings. Neither symmetry nor the triangle inequality are assumed.
 */
@FunctionalInterface
public interface EmbeddingDistance
{
	double apply(double[] e1, double[] e2);
}

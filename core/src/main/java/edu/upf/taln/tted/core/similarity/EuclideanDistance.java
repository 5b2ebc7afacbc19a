package edu.upf.taln.tted.core.similarity;

public class EuclideanDistance implements EmbeddingDistance
{
	@Override
	public double apply(double[] v1, double[] v2)
	{
		double sum = 0.0;
		for (int i = 0; i < v1.length; i++)
			sum += Math.pow(v1[i] - v2[i], 2);

		return Math.sqrt(sum);
	}
}

package edu.upf.taln.tted.treeeditdistance;

import java.util.Arrays;

/**
 * Ordered tree edit distance following the keyroot decomposition of Zhang and Shasha (1989).
 * Sibling order is preserved by every edit script considered.
 * Time is O(|T1| |T2| min(depth, leaves)^2 ) and memory O(|T1| |T2|), regardless of the cost values.
 * Immutable class.
 */
public final class OrderedTreeEditDistance implements TreeEditDistance
{
	private final EditScore score;

	public OrderedTreeEditDistance(EditScore score)
	{
		this.score = score;
	}

	@Override
	public double calc(Tree tree1, Tree tree2)
	{
		final PostorderIndex t1 = new PostorderIndex(tree1);
		final PostorderIndex t2 = new PostorderIndex(tree2);
		final double[] deletions = t1.deletionCosts(score);
		final double[] insertions = t2.insertionCosts(score);

		if (t1.size == 0)
			return Arrays.stream(insertions).sum();
		if (t2.size == 0)
			return Arrays.stream(deletions).sum();

		final double[][] replacements = PostorderIndex.replacementCosts(t1, t2, score);
		final double[][] tree_dist = new double[t1.size][t2.size];

		for (int k1 : t1.keyroots())
			for (int k2 : t2.keyroots())
				forestDistance(k1, k2, t1, t2, deletions, insertions, replacements, tree_dist);

		return tree_dist[t1.size - 1][t2.size - 1];
	}

	private static void forestDistance(int k1, int k2, PostorderIndex t1, PostorderIndex t2, double[] deletions,
	                                   double[] insertions, double[][] replacements, double[][] tree_dist)
	{
		final int l1 = t1.leftmost[k1];
		final int l2 = t2.leftmost[k2];
		final int rows = k1 - l1 + 2;
		final int cols = k2 - l2 + 2;

		// forest_dist[x][y] is the distance between forests l1..l1+x-1 and l2..l2+y-1
		final double[][] forest_dist = new double[rows][cols];
		for (int x = 1; x < rows; ++x)
			forest_dist[x][0] = forest_dist[x - 1][0] + deletions[l1 + x - 1];
		for (int y = 1; y < cols; ++y)
			forest_dist[0][y] = forest_dist[0][y - 1] + insertions[l2 + y - 1];

		for (int x = 1; x < rows; ++x)
		{
			final int a = l1 + x - 1;
			for (int y = 1; y < cols; ++y)
			{
				final int b = l2 + y - 1;
				final double delete = forest_dist[x - 1][y] + deletions[a];
				final double insert = forest_dist[x][y - 1] + insertions[b];

				if (t1.leftmost[a] == l1 && t2.leftmost[b] == l2)
				{
					// both forests are whole trees
					final double replace = forest_dist[x - 1][y - 1] + replacements[a][b];
					forest_dist[x][y] = Math.min(Math.min(delete, insert), replace);
					tree_dist[a][b] = forest_dist[x][y];
				}
				else
				{
					final int p = t1.leftmost[a] - l1;
					final int q = t2.leftmost[b] - l2;
					final double match = forest_dist[p][q] + tree_dist[a][b];
					forest_dist[x][y] = Math.min(Math.min(delete, insert), match);
				}
			}
		}
	}
}

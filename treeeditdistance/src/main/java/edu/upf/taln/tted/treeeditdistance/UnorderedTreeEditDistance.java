package edu.upf.taln.tted.treeeditdistance;

import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.MatchingAlgorithm;
import org.jgrapht.alg.matching.KuhnMunkresMinimalWeightBipartitePerfectMatching;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleWeightedGraph;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Unordered tree edit distance approximated with the constrained edit distance of Zhang (1996).
 * Exact unordered edit distance is NP-hard, so mappings are restricted to those where disjoint subtrees map to
 * disjoint subtrees. Children of every aligned pair of nodes are then matched with a minimum cost assignment, where
 * unmatched children pay for deleting or inserting their whole subtree.
 * The result is polynomial to compute, zero for identical trees under a cost function that is zero at identity, and
 * an upper bound of the true unordered distance. It is not guaranteed to be minimal for wide branching factors.
 * It can even exceed the ordered distance between the same trees, as the ordered mapping need not be constrained.
 * The ordered distance is not used to tighten the bound, since the result would then depend on the order of siblings.
 * Immutable class.
 */
public final class UnorderedTreeEditDistance implements TreeEditDistance
{
	private final EditScore score;

	public UnorderedTreeEditDistance(EditScore score)
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

		// Costs of removing each subtree (and each forest of children) altogether
		final double[] delete_forest = new double[t1.size];
		final double[] delete_tree = new double[t1.size];
		for (int i = 0; i < t1.size; ++i)
		{
			for (int c : t1.children[i])
				delete_forest[i] += delete_tree[c];
			delete_tree[i] = deletions[i] + delete_forest[i];
		}
		final double[] insert_forest = new double[t2.size];
		final double[] insert_tree = new double[t2.size];
		for (int j = 0; j < t2.size; ++j)
		{
			for (int c : t2.children[j])
				insert_forest[j] += insert_tree[c];
			insert_tree[j] = insertions[j] + insert_forest[j];
		}

		final double[][] tree_dist = new double[t1.size][t2.size];
		final double[][] forest_dist = new double[t1.size][t2.size];
		for (int i = 0; i < t1.size; ++i)
		{
			final int[] children1 = t1.children[i];
			for (int j = 0; j < t2.size; ++j)
			{
				final int[] children2 = t2.children[j];

				// Forests: match children one to one, or map the whole forest into the children of a single child
				double forest = matchChildren(children1, children2, tree_dist, delete_tree, insert_tree);
				for (int c2 : children2)
					forest = Math.min(forest, insert_forest[j] + forest_dist[i][c2] - insert_forest[c2]);
				for (int c1 : children1)
					forest = Math.min(forest, delete_forest[i] + forest_dist[c1][j] - delete_forest[c1]);
				forest_dist[i][j] = forest;

				// Trees: align the roots, or map one tree entirely into a subtree of the other
				double tree = forest + replacements[i][j];
				for (int c2 : children2)
					tree = Math.min(tree, insert_tree[j] + tree_dist[i][c2] - insert_tree[c2]);
				for (int c1 : children1)
					tree = Math.min(tree, delete_tree[i] + tree_dist[c1][j] - delete_tree[c1]);
				tree_dist[i][j] = tree;
			}
		}

		return tree_dist[t1.size - 1][t2.size - 1];
	}

	/**
	 * Minimum cost assignment between two sets of children, solved as a perfect matching over a complete bipartite
	 * graph padded with one deletion slot per child of the first set and one insertion slot per child of the second.
	 */
	private static double matchChildren(int[] children1, int[] children2, double[][] tree_dist, double[] delete_tree,
	                                    double[] insert_tree)
	{
		final int m = children1.length;
		final int n = children2.length;
		if (m == 0)
			return Arrays.stream(children2).mapToDouble(c -> insert_tree[c]).sum();
		if (n == 0)
			return Arrays.stream(children1).mapToDouble(c -> delete_tree[c]).sum();

		// left side: children1 then insertion slots, right side: children2 then deletion slots
		final int k = m + n;
		final Graph<Integer, DefaultWeightedEdge> graph = new SimpleWeightedGraph<>(DefaultWeightedEdge.class);
		IntStream.range(0, 2 * k).forEach(graph::addVertex);
		for (int a = 0; a < k; ++a)
		{
			for (int b = 0; b < k; ++b)
			{
				final double weight;
				if (a < m && b < n)
					weight = tree_dist[children1[a]][children2[b]];
				else if (a < m)
					weight = delete_tree[children1[a]];
				else if (b < n)
					weight = insert_tree[children2[b]];
				else
					weight = 0.0;

				final DefaultWeightedEdge e = graph.addEdge(a, k + b);
				graph.setEdgeWeight(e, weight);
			}
		}

		final Set<Integer> left = IntStream.range(0, k).boxed().collect(Collectors.toSet());
		final Set<Integer> right = IntStream.range(k, 2 * k).boxed().collect(Collectors.toSet());
		final MatchingAlgorithm.Matching<Integer, DefaultWeightedEdge> matching =
				new KuhnMunkresMinimalWeightBipartitePerfectMatching<>(graph, left, right).getMatching();

		return matching.getEdges().stream()
				.mapToDouble(graph::getEdgeWeight)
				.sum();
	}
}

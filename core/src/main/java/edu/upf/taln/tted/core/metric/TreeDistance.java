package edu.upf.taln.tted.core.metric;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import edu.upf.taln.tted.core.Options;
import edu.upf.taln.tted.core.similarity.*;
import edu.upf.taln.tted.core.structures.TextTree;
import edu.upf.taln.tted.treeeditdistance.OrderedTreeEditDistance;
import edu.upf.taln.tted.treeeditdistance.TreeEditDistance;
import edu.upf.taln.tted.treeeditdistance.UnorderedTreeEditDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Semantic tree edit distance between pairs of text trees.
 * Edit costs come from distances between embeddings of node labels: replacing a label costs the distance between the
 * two embeddings, deleting or inserting it costs the distance between its embedding and that of the empty string.
 * Stateless, instances can be shared by concurrent comparisons as long as the encoder and distance function are
 * thread-safe.
 */
public final class TreeDistance
{
	private final SentenceEncoder encoder;
	private final EmbeddingDistance distance;
	private final static Logger log = LogManager.getLogger();

	public TreeDistance(SentenceEncoder encoder, EmbeddingDistance distance)
	{
		this.encoder = encoder;
		this.distance = distance;
	}

	public double compare(TextTree tree1, TextTree tree2, boolean normalize, boolean unordered, boolean use_context,
	                      Integer depth_limit)
	{
		final Options options = new Options();
		options.normalize = normalize;
		options.unordered = unordered;
		options.use_context = use_context;
		options.depth_limit = depth_limit;
		return compare(tree1, tree2, options);
	}

	/**
	 * Trees are first truncated to options.depth_limit, if set, then relabeled with their ancestors' labels if
	 * options.use_context is true. Edit costs are computed for the resulting trees.
	 *
	 * @return raw edit distance, or normalized to [0,1] if options.normalize is true, 1 being only reachable when
	 * exactly one of the trees is empty
	 * @throws IllegalArgumentException if options.depth_limit is lower than 1
	 */
	public double compare(TextTree tree1, TextTree tree2, Options options)
	{
		Preconditions.checkArgument(options.depth_limit == null || options.depth_limit >= 1,
				"Depth limit must be at least 1, got %s", options.depth_limit);

		TextTree t1 = tree1;
		TextTree t2 = tree2;
		if (options.depth_limit != null)
		{
			t1 = t1.truncate(options.depth_limit);
			t2 = t2.truncate(options.depth_limit);
		}
		if (options.use_context)
		{
			t1 = t1.contextualize(options.context_separator);
			t2 = t2.contextualize(options.context_separator);
		}

		final Stopwatch timer = Stopwatch.createStarted();
		final CostTable costs = CostTable.build(t1, t2, encoder, distance);
		final TextTreeProxy proxy1 = new TextTreeProxy(t1);
		final TextTreeProxy proxy2 = new TextTreeProxy(t2);
		final TextTreeEditScore score = new TextTreeEditScore(costs, proxy1, proxy2);
		final TreeEditDistance ted = options.unordered ? new UnorderedTreeEditDistance(score) : new OrderedTreeEditDistance(score);
		final double raw = ted.calc(proxy1, proxy2);
		log.debug("Distance between trees of sizes " + t1.size() + " and " + t2.size() + " is " + raw +
				" (" + (options.unordered ? "unordered" : "ordered") + "), took " + timer.stop());

		if (!options.normalize)
			return raw;
		return normalize(raw, costs.getMaxUnaryCost(), t1.size(), t2.size());
	}

	/**
	 * Rescales a raw distance as 2d / (c (n1 + n2) + d), where c is the largest deletion/insertion cost.
	 * Returns 0 for two empty trees, and for trees whose costs are all zero.
	 * The result lies in [0,1) except when exactly one tree is empty: all nodes of the other tree are then inserted
	 * or deleted, and the result is 1 if every one of them has the largest unary cost.
	 */
	static double normalize(double raw, double max_unary_cost, int size1, int size2)
	{
		if (size1 == 0 && size2 == 0)
			return 0.0;
		final double denominator = max_unary_cost * (size1 + size2) + raw;
		if (denominator == 0.0)
			return 0.0;
		return 2.0 * raw / denominator;
	}
}

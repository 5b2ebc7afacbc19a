package edu.upf.taln.tted.core.metric;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import edu.upf.taln.tted.core.Options;
import edu.upf.taln.tted.core.structures.TextTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Depth-averaged tree distance: arithmetic mean of the normalized distances between the trees truncated at each
 * depth from 1 to the maximum depth of either tree, or to a given depth limit if lower.
 */
public final class AveragedTreeDistance
{
	private final TreeDistance distance;
	private final static Logger log = LogManager.getLogger();

	public AveragedTreeDistance(TreeDistance distance)
	{
		this.distance = distance;
	}

	public double compare(TextTree tree1, TextTree tree2, boolean unordered, boolean use_context, Integer depth_limit)
	{
		final Options options = new Options();
		options.unordered = unordered;
		options.use_context = use_context;
		options.depth_limit = depth_limit;
		return compare(tree1, tree2, options);
	}

	/**
	 * options.normalize is ignored, distances at each depth are always normalized.
	 *
	 * @throws IllegalArgumentException if options.depth_limit is lower than 1 or both trees are empty
	 */
	public double compare(TextTree tree1, TextTree tree2, Options options)
	{
		final double[] distances = compareAtDepths(tree1, tree2, options);
		return Arrays.stream(distances).average().orElseThrow();
	}

	/**
	 * @return normalized distances at depths 1, 2, ..., in this order
	 */
	public double[] compareAtDepths(TextTree tree1, TextTree tree2, Options options)
	{
		Preconditions.checkArgument(options.depth_limit == null || options.depth_limit >= 1,
				"Depth limit must be at least 1, got %s", options.depth_limit);
		int max_depth = Math.max(tree1.getMaxDepth(), tree2.getMaxDepth());
		if (options.depth_limit != null)
			max_depth = Math.min(max_depth, options.depth_limit);
		Preconditions.checkArgument(max_depth >= 1, "Cannot average distances between two empty trees");

		final Stopwatch timer = Stopwatch.createStarted();
		IntStream depths = IntStream.rangeClosed(1, max_depth);
		if (options.parallel)
			depths = depths.parallel();

		final double[] distances = depths
				.mapToDouble(depth ->
				{
					final Options depth_options = new Options(options);
					depth_options.normalize = true;
					depth_options.depth_limit = depth;
					return distance.compare(tree1, tree2, depth_options);
				})
				.toArray();
		log.debug("Distances at " + max_depth + " depths computed in " + timer.stop() + ": " + Arrays.toString(distances));

		return distances;
	}
}

package edu.upf.taln.tted.core.metric;

import edu.upf.taln.tted.core.LabelIdEncoder;
import edu.upf.taln.tted.core.Options;
import edu.upf.taln.tted.core.io.TextTreeReader;
import edu.upf.taln.tted.core.structures.TextTree;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class AveragedTreeDistanceTest
{
	private static final double delta = 1e-9;
	private final TreeDistance metric = new TreeDistance(new LabelIdEncoder(), LabelIdEncoder.exactMatch());
	private final AveragedTreeDistance averaged = new AveragedTreeDistance(metric);
	private final TextTree t1 = TextTreeReader.readString("{\"r\": {\"a\": {\"c\": {}}, \"b\": {}}}");
	private final TextTree t2 = TextTreeReader.readString("{\"r\": {\"b\": {}, \"x\": {}}}");

	@Test
	public void testAverage()
	{
		assertEquals((0.0 + 2.0 / 7.0 + 4.0 / 9.0) / 3.0, averaged.compare(t1, t2, true, false, null), delta);
		assertEquals((0.0 + 2.0 / 7.0) / 2.0, averaged.compare(t1, t2, true, false, 2), delta);
		assertEquals(0.0, averaged.compare(t1, t2, true, false, 1), delta);
		// limits above the maximum depth are clipped
		assertEquals(averaged.compare(t1, t2, true, false, null), averaged.compare(t1, t2, true, false, 10), delta);
	}

	@Test
	public void testConsistentWithTruncatedDistances()
	{
		Random random = new Random(17);
		String[] alphabet = {"one", "two", "three"};
		for (int i = 0; i < 30; ++i)
		{
			TextTree a = TreeDistanceTest.randomTree(random, alphabet);
			TextTree b = TreeDistanceTest.randomTree(random, alphabet);
			boolean unordered = random.nextBoolean();
			boolean context = random.nextBoolean();
			int limit = 1 + random.nextInt(4);
			int max_depth = Math.min(limit, Math.max(a.getMaxDepth(), b.getMaxDepth()));

			double sum = 0.0;
			for (int k = 1; k <= max_depth; ++k)
				sum += metric.compare(a, b, true, unordered, context, k);
			assertEquals(sum / max_depth, averaged.compare(a, b, unordered, context, limit), delta);
		}
	}

	@Test
	public void testParallel()
	{
		Options options = new Options();
		double[] sequential = averaged.compareAtDepths(t1, t2, options);
		options.parallel = true;
		double[] parallel = averaged.compareAtDepths(t1, t2, options);
		assertArrayEquals(sequential, parallel, delta);
		assertEquals(3, parallel.length);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBothEmpty()
	{
		averaged.compare(TextTree.empty(), TextTree.empty(), true, false, null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidDepthLimit()
	{
		averaged.compare(t1, t2, true, false, 0);
	}

	@Test
	public void testOneEmptyTree()
	{
		// every truncation of t2 is deleted entirely: 2c n / (c n + c n) = 1
		assertEquals(1.0, averaged.compare(TextTree.empty(), t2, false, false, null), delta);
	}
}

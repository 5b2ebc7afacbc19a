package edu.upf.taln.tted.core.similarity;

import edu.upf.taln.tted.core.LabelIdEncoder;
import edu.upf.taln.tted.core.io.TextTreeReader;
import edu.upf.taln.tted.core.structures.TextTree;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class CostTableTest
{
	private static final double delta = 1e-9;

	@Test
	public void testEncoderCalledTwice()
	{
		TextTree t1 = TextTreeReader.readString("{\"a\": {\"b\": {}, \"c\": {\"b\": {}}}}");
		TextTree t2 = TextTreeReader.readString("{\"a\": {\"d\": {}}}");
		LabelIdEncoder encoder = new LabelIdEncoder();
		CostTable costs = CostTable.build(t1, t2, encoder, LabelIdEncoder.exactMatch());

		List<List<String>> calls = encoder.getCalls();
		assertEquals(2, calls.size());
		assertEquals(List.of("a", "b", "c", "d"), calls.get(0)); // distinct labels only
		assertEquals(List.of(""), calls.get(1));

		assertEquals(0.0, costs.getSubstitutionCost("a", "a"), delta);
		assertEquals(1.0, costs.getSubstitutionCost("b", "d"), delta);
		assertEquals(1.0, costs.getUnaryCost("c"), delta);
		assertEquals(1.0, costs.getUnaryCost("d"), delta);
		assertEquals(1.0, costs.getMaxUnaryCost(), delta);
	}

	@Test
	public void testEmptyTrees()
	{
		LabelIdEncoder encoder = new LabelIdEncoder();
		CostTable costs = CostTable.build(TextTree.empty(), TextTree.empty(), encoder, LabelIdEncoder.exactMatch());
		assertTrue(encoder.getCalls().isEmpty());
		assertEquals(0.0, costs.getMaxUnaryCost(), delta);
	}

	@Test
	public void testAsymmetricDistance()
	{
		TextTree t1 = TextTreeReader.readString("{\"short\": {}}");
		TextTree t2 = TextTreeReader.readString("{\"longer\": {}}");
		SentenceEncoder lengths = sentences -> sentences.stream()
				.map(s -> new double[]{s.length()})
				.collect(Collectors.toList());
		EmbeddingDistance directed = (e1, e2) -> Math.max(0.0, e1[0] - e2[0]) + 2.0 * Math.max(0.0, e2[0] - e1[0]);
		CostTable costs = CostTable.build(t1, t2, lengths, directed);

		assertEquals(2.0, costs.getSubstitutionCost("short", "longer"), delta);
		assertEquals(5.0, costs.getUnaryCost("short"), delta);
		assertEquals(6.0, costs.getUnaryCost("longer"), delta);
		assertEquals(6.0, costs.getMaxUnaryCost(), delta);
	}

	@Test(expected = IllegalStateException.class)
	public void testMissingLabel()
	{
		TextTree t = TextTreeReader.readString("{\"a\": {}}");
		CostTable costs = CostTable.build(t, t, new LabelIdEncoder(), LabelIdEncoder.exactMatch());
		costs.getSubstitutionCost("a", "z");
	}

	@Test
	public void testEncoderFailurePropagates()
	{
		TextTree t = TextTreeReader.readString("{\"a\": {}}");
		UnsupportedOperationException failure = new UnsupportedOperationException("encoder offline");
		try
		{
			CostTable.build(t, t, s -> { throw failure; }, LabelIdEncoder.exactMatch());
			fail("Expected encoder failure");
		}
		catch (UnsupportedOperationException e)
		{
			assertSame(failure, e);
		}
	}

	@Test
	public void testCosineDistance()
	{
		CosineDistance cosine = new CosineDistance();
		assertEquals(0.0, cosine.apply(new double[]{1, 2}, new double[]{2, 4}), delta);
		assertEquals(1.0, cosine.apply(new double[]{1, 0}, new double[]{0, 3}), delta);
		assertEquals(2.0, cosine.apply(new double[]{1, 0}, new double[]{-1, 0}), delta);
		assertEquals(1.0, cosine.apply(new double[]{1, 0}, new double[]{0, 0}), delta);
		assertEquals(0.0, cosine.apply(new double[]{0, 0}, new double[]{0, 0}), delta);
	}

	@Test
	public void testEuclideanDistance()
	{
		assertEquals(5.0, new EuclideanDistance().apply(new double[]{0, 0}, new double[]{3, 4}), delta);
	}
}

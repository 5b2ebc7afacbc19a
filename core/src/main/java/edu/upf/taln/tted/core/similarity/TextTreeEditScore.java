package edu.upf.taln.tted.core.similarity;

import edu.upf.taln.tted.treeeditdistance.EditScore;

/**
 * Implementation of EditScore interface for the tree edit distance algorithms.
 * Costs are looked up by label in a precomputed cost table.
 * Immutable class.
 */
public final class TextTreeEditScore implements EditScore
{
	private final CostTable costs;
	private final TextTreeProxy tree1;
	private final TextTreeProxy tree2;

	public TextTreeEditScore(CostTable costs, TextTreeProxy tree1, TextTreeProxy tree2)
	{
		this.costs = costs;
		this.tree1 = tree1;
		this.tree2 = tree2;
	}

	@Override
	public double replace(int i1, int i2)
	{
		return costs.getSubstitutionCost(tree1.getLabel(i1), tree2.getLabel(i2));
	}

	@Override
	public double delete(int i)
	{
		return costs.getUnaryCost(tree1.getLabel(i));
	}

	@Override
	public double insert(int i)
	{
		return costs.getUnaryCost(tree2.getLabel(i));
	}
}

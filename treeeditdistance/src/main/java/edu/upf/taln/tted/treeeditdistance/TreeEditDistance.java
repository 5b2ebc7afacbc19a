package edu.upf.taln.tted.treeeditdistance;

/**
 * Minimum total cost of insertions, deletions and replacements that transform one tree into another, where the cost
 * of each operation is given by an {@link EditScore}.
 */
public interface TreeEditDistance
{
	double calc(Tree tree1, Tree tree2);
}

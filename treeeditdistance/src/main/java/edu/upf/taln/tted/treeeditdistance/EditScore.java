package edu.upf.taln.tted.treeeditdistance;

/**
 * Costs of the three edit operations. Node ids refer to the first tree (node1) and to the second tree (node2).
 * Implementations must return nonnegative values.
 */
public interface EditScore
{
	double replace(int node1, int node2);

	double delete(int node1);

	double insert(int node2);
}

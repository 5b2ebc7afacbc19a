package edu.upf.taln.tted.treeeditdistance;

/**
 * Index-based view of a rooted ordered tree as consumed by the edit distance algorithms.
 * Nodes are identified by integers in the range [0, size()). Labels are not part of this view, costs are resolved
 * through an {@link EditScore} that knows how to map node ids to labels.
 */
public interface Tree
{
	int NOT_FOUND = -1;

	/**
	 * @return id of the root node, or NOT_FOUND if the tree is empty
	 */
	int getRoot();

	int getFirstChild(int nodeId);

	int getNextSibling(int nodeId);

	int getParent(int nodeId);

	int size();
}

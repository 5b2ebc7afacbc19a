package edu.upf.taln.tted.treeeditdistance;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Postorder decomposition of a {@link Tree} shared by the edit distance algorithms.
 * Positions are postorder ranks, so every node comes after all of its descendants and the root is last.
 * Built with an explicit stack, deep trees do not consume call stack.
 */
final class PostorderIndex
{
	final int size;
	final int[] nodes; // node id at each position
	final int[][] children; // positions of the children of each position, left to right
	final int[] leftmost; // position of the leftmost leaf descendant

	PostorderIndex(Tree tree)
	{
		size = tree.size();
		nodes = new int[size];
		children = new int[size][];
		leftmost = new int[size];

		final int root = tree.getRoot();
		if (root == Tree.NOT_FOUND)
		{
			Preconditions.checkArgument(size == 0, "Tree of size %s has no root", size);
			return;
		}

		final int[] positions = new int[size];
		Arrays.fill(positions, -1);

		// each stack entry holds a node id and the id of its next child to visit
		final Deque<int[]> stack = new ArrayDeque<>();
		stack.push(new int[]{root, tree.getFirstChild(root)});
		int counter = 0;
		while (!stack.isEmpty())
		{
			final int[] top = stack.peek();
			if (top[1] != Tree.NOT_FOUND)
			{
				final int child = top[1];
				top[1] = tree.getNextSibling(child);
				stack.push(new int[]{child, tree.getFirstChild(child)});
			}
			else
			{
				stack.pop();
				final int node = top[0];
				Preconditions.checkArgument(node >= 0 && node < size && positions[node] == -1,
						"Node %s is out of range or reachable more than once", node);
				positions[node] = counter;
				nodes[counter] = node;
				++counter;
			}
		}
		Preconditions.checkArgument(counter == size, "Only %s out of %s nodes are reachable from the root", counter, size);

		for (int p = 0; p < size; ++p)
		{
			int num_children = 0;
			for (int c = tree.getFirstChild(nodes[p]); c != Tree.NOT_FOUND; c = tree.getNextSibling(c))
				++num_children;

			children[p] = new int[num_children];
			int k = 0;
			for (int c = tree.getFirstChild(nodes[p]); c != Tree.NOT_FOUND; c = tree.getNextSibling(c))
				children[p][k++] = positions[c];

			leftmost[p] = num_children == 0 ? p : leftmost[children[p][0]];
		}
	}

	/**
	 * Keyroots are the root plus every node having a left sibling, i.e. the highest node of each leftmost path.
	 * Returned in increasing position order.
	 */
	int[] keyroots()
	{
		final boolean[] seen = new boolean[size];
		final int[] keyroots = new int[size];
		int k = size;
		for (int p = size - 1; p >= 0; --p)
		{
			if (!seen[leftmost[p]])
			{
				seen[leftmost[p]] = true;
				keyroots[--k] = p;
			}
		}
		return Arrays.copyOfRange(keyroots, k, size);
	}

	double[] deletionCosts(EditScore score)
	{
		return Arrays.stream(nodes).mapToDouble(score::delete).toArray();
	}

	double[] insertionCosts(EditScore score)
	{
		return Arrays.stream(nodes).mapToDouble(score::insert).toArray();
	}

	static double[][] replacementCosts(PostorderIndex t1, PostorderIndex t2, EditScore score)
	{
		final double[][] costs = new double[t1.size][t2.size];
		for (int i = 0; i < t1.size; ++i)
			for (int j = 0; j < t2.size; ++j)
				costs[i][j] = score.replace(t1.nodes[i], t2.nodes[j]);
		return costs;
	}
}

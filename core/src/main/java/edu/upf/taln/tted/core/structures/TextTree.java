package edu.upf.taln.tted.core.structures;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.*;

/**
 * Rooted ordered tree of short texts stored as an array of labels plus child adjacency lists.
 * Node 0 is the root. Depths are derived at construction, the root having depth 1.
 * Immutable class, derived trees are returned by {@link #truncate(int)} and {@link #contextualize()}.
 */
public final class TextTree
{
	private static final TextTree empty_tree = new TextTree(List.of(), List.of());
	private final ImmutableList<String> labels;
	private final ImmutableList<ImmutableList<Integer>> adjacency;
	private final int[] parents;
	private final int[] depths;
	private final int max_depth;

	/**
	 * @param labels    label of each node, node 0 being the root
	 * @param adjacency ordered child indices of each node
	 * @throws MalformedTreeException if the adjacency lists do not describe a single tree rooted at node 0
	 */
	public TextTree(List<String> labels, List<? extends List<Integer>> adjacency)
	{
		if (labels.size() != adjacency.size())
			throw new MalformedTreeException("Got " + labels.size() + " labels but " + adjacency.size() + " adjacency lists");
		if (labels.stream().anyMatch(Objects::isNull))
			throw new MalformedTreeException("Null labels are not allowed");

		final int num_nodes = labels.size();
		this.labels = ImmutableList.copyOf(labels);
		this.parents = new int[num_nodes];
		Arrays.fill(parents, -1);

		final ImmutableList.Builder<ImmutableList<Integer>> builder = ImmutableList.builder();
		for (int node = 0; node < num_nodes; ++node)
		{
			final List<Integer> children = adjacency.get(node);
			if (children == null)
				throw new MalformedTreeException("Node " + node + " has no adjacency list");
			for (Integer child : children)
			{
				if (child == null || child <= 0 || child >= num_nodes)
					throw new MalformedTreeException("Node " + node + " has invalid child " + child);
				if (parents[child] != -1)
					throw new MalformedTreeException("Node " + child + " has more than one parent");
				parents[child] = node;
			}
			builder.add(ImmutableList.copyOf(children));
		}
		this.adjacency = builder.build();

		// Breadth-first traversal from the root, every node must be reached
		depths = new int[num_nodes];
		int num_visited = 0;
		int deepest = 0;
		if (num_nodes > 0)
		{
			final Deque<Integer> queue = new ArrayDeque<>();
			depths[0] = 1;
			queue.add(0);
			while (!queue.isEmpty())
			{
				final int node = queue.poll();
				++num_visited;
				deepest = Math.max(deepest, depths[node]);
				for (int child : this.adjacency.get(node))
				{
					depths[child] = depths[node] + 1;
					queue.add(child);
				}
			}
		}
		if (num_visited != num_nodes)
			throw new MalformedTreeException((num_nodes - num_visited) + " nodes are not reachable from the root");
		max_depth = deepest;
	}

	public static TextTree empty() { return empty_tree; }

	public int size() { return labels.size(); }
	public boolean isEmpty() { return labels.isEmpty(); }
	public String getLabel(int node) { return labels.get(node); }
	public ImmutableList<String> getLabels() { return labels; }
	public ImmutableList<Integer> getChildren(int node) { return adjacency.get(node); }
	public ImmutableList<ImmutableList<Integer>> getAdjacency() { return adjacency; }
	public int getDepth(int node) { return depths[node]; }

	/**
	 * @return index of the parent of a node, or -1 for the root
	 */
	public int getParent(int node) { return parents[node]; }

	/**
	 * @return depth of the deepest node, 0 for the empty tree
	 */
	public int getMaxDepth() { return max_depth; }

	public List<Integer> getPreorder()
	{
		final List<Integer> preorder = new ArrayList<>(size());
		if (isEmpty())
			return preorder;

		final Deque<Integer> stack = new ArrayDeque<>();
		stack.push(0);
		while (!stack.isEmpty())
		{
			final int node = stack.pop();
			preorder.add(node);
			final List<Integer> children = adjacency.get(node);
			for (int i = children.size() - 1; i >= 0; --i)
				stack.push(children.get(i));
		}
		return preorder;
	}

	/**
	 * Tree with the nodes at depth lower or equal than the given one. Nodes at that depth become leaves.
	 * Kept nodes are renumbered contiguously preserving their relative order.
	 */
	public TextTree truncate(int depth)
	{
		Preconditions.checkArgument(depth >= 1, "Truncation depth must be at least 1, got %s", depth);
		if (depth >= max_depth)
			return this;

		final int[] new_index = new int[size()];
		final List<Integer> kept = new ArrayList<>();
		for (int node = 0; node < size(); ++node)
		{
			new_index[node] = depths[node] <= depth ? kept.size() : -1;
			if (depths[node] <= depth)
				kept.add(node);
		}

		final List<String> new_labels = new ArrayList<>(kept.size());
		final List<List<Integer>> new_adjacency = new ArrayList<>(kept.size());
		for (int node : kept)
		{
			new_labels.add(labels.get(node));
			final List<Integer> children = new ArrayList<>();
			if (depths[node] < depth)
				adjacency.get(node).forEach(c -> children.add(new_index[c]));
			new_adjacency.add(children);
		}

		return new TextTree(new_labels, new_adjacency);
	}

	/**
	 * Same as {@link #contextualize(String)} with a single space as separator.
	 */
	public TextTree contextualize()
	{
		return contextualize(" ");
	}

	/**
	 * Tree with the same structure where each label is prefixed with the labels of all its ancestors, from the root
	 * down. The root keeps its own label.
	 */
	public TextTree contextualize(String separator)
	{
		final String[] new_labels = new String[size()];
		for (int node : getPreorder()) // parents are always relabeled before their children
		{
			final int parent = parents[node];
			new_labels[node] = parent == -1 ? labels.get(node) : new_labels[parent] + separator + labels.get(node);
		}

		return new TextTree(Arrays.asList(new_labels), adjacency);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TextTree other = (TextTree) o;
		return labels.equals(other.labels) && adjacency.equals(other.adjacency);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(labels, adjacency);
	}

	// One node per line, indented with a dash per level below the root
	@Override
	public String toString()
	{
		final StringBuilder builder = new StringBuilder();
		for (int node : getPreorder())
		{
			builder.append(Strings.repeat("-", depths[node] - 1));
			builder.append(labels.get(node));
			builder.append('\n');
		}
		return builder.toString();
	}
}

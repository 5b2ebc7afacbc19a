package edu.upf.taln.tted.core.similarity;

import edu.upf.taln.tted.core.structures.TextTree;
import edu.upf.taln.tted.treeeditdistance.Tree;

import java.util.Arrays;
import java.util.List;


/**
 * A proxy class for text trees that provides a view of them as the Tree objects manipulated by the tree edit
 * distance algorithms. Node ids are the indices of the text tree.
 * Immutable class.
 */
public final class TextTreeProxy implements Tree
{
	private final TextTree tree;
	private final int[] next_siblings;

	public TextTreeProxy(TextTree tree)
	{
		this.tree = tree;
		next_siblings = new int[tree.size()];
		Arrays.fill(next_siblings, NOT_FOUND);
		for (int i = 0; i < tree.size(); ++i)
		{
			final List<Integer> children = tree.getChildren(i);
			for (int j = 0; j + 1 < children.size(); ++j)
				next_siblings[children.get(j)] = children.get(j + 1);
		}
	}

	public String getLabel(int i)
	{
		return tree.getLabel(i);
	}

	@Override
	public int getRoot()
	{
		return tree.isEmpty() ? NOT_FOUND : 0;
	}

	@Override
	public int getFirstChild(int i)
	{
		if (i < 0 || i >= tree.size())
			return NOT_FOUND;
		final List<Integer> children = tree.getChildren(i);
		return children.isEmpty() ? NOT_FOUND : children.get(0);
	}

	@Override
	public int getNextSibling(int i)
	{
		if (i < 0 || i >= tree.size())
			return NOT_FOUND;
		return next_siblings[i];
	}

	@Override
	public int getParent(int i)
	{
		if (i < 0 || i >= tree.size())
			return NOT_FOUND;
		final int parent = tree.getParent(i);
		return parent == -1 ? NOT_FOUND : parent; // root has no parent
	}

	@Override
	public int size()
	{
		return tree.size();
	}
}

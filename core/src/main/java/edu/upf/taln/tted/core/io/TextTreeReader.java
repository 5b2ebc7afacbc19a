package edu.upf.taln.tted.core.io;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import edu.upf.taln.tted.core.structures.MalformedTreeException;
import edu.upf.taln.tted.core.structures.TextTree;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads trees from the nested exchange format, where every subtree is a single-entry mapping from a label to the
 * mapping of its children, e.g. {"root": {"child 1": {"grandchild": {}}, "child 2": {}}}.
 * An empty child mapping denotes a leaf. Children are numbered in preorder following the order of the keys.
 */
public final class TextTreeReader
{
	private static final Gson gson = new Gson();
	private static final Type nested_type = new TypeToken<Map<String, Object>>() {}.getType();
	private final static Logger log = LogManager.getLogger();

	private TextTreeReader() {}

	public static TextTree read(Path path) throws IOException
	{
		log.debug("Reading tree from " + path);
		final String json = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		try
		{
			return readString(json);
		}
		catch (MalformedTreeException e)
		{
			throw new MalformedTreeException("Cannot read tree from " + path + ": " + e.getMessage(), e);
		}
	}

	public static TextTree readString(String json)
	{
		final Map<String, Object> nested;
		try
		{
			nested = gson.fromJson(json, nested_type);
		}
		catch (JsonParseException e)
		{
			throw new MalformedTreeException("Invalid JSON tree: " + e.getMessage(), e);
		}
		if (nested == null)
			throw new MalformedTreeException("Empty JSON input");

		return fromNested(nested);
	}

	/**
	 * Builds a tree from nested maps. Map implementations with a defined iteration order should be used, as it
	 * determines the order of siblings.
	 */
	public static TextTree fromNested(Map<?, ?> nested)
	{
		if (nested == null || nested.size() != 1)
			throw new MalformedTreeException("A tree must have exactly one root entry, got " +
					(nested == null ? 0 : nested.size()));

		final List<String> labels = new ArrayList<>();
		final List<List<Integer>> adjacency = new ArrayList<>();
		final List<Integer> parents = new ArrayList<>();
		final List<Map<?, ?>> children_maps = new ArrayList<>();

		// entries are visited depth-first, each paired with the index of its parent
		final Deque<Pair<Map.Entry<?, ?>, Integer>> stack = new ArrayDeque<>();
		final Map.Entry<?, ?> root = nested.entrySet().iterator().next();
		stack.push(Pair.of(root, -1));
		while (!stack.isEmpty())
		{
			final Pair<Map.Entry<?, ?>, Integer> current = stack.pop();
			final int parent = current.getRight();
			final Object key = current.getLeft().getKey();
			final Object value = current.getLeft().getValue();
			if (!(key instanceof String))
				throw new MalformedTreeException("Label " + key + " is not a string");
			if (!(value instanceof Map))
				throw new MalformedTreeException("Children of \"" + key + "\" must be a mapping, got " + value);
			// a mapping may be shared by unrelated subtrees, but never appear among its own ancestors
			for (int ancestor = parent; ancestor != -1; ancestor = parents.get(ancestor))
			{
				if (children_maps.get(ancestor) == value)
					throw new MalformedTreeException("Cycle at \"" + key + "\": its children mapping is also that of " +
							"ancestor \"" + labels.get(ancestor) + "\"");
			}

			final int node = labels.size();
			labels.add((String) key);
			adjacency.add(new ArrayList<>());
			parents.add(parent);
			children_maps.add((Map<?, ?>) value);
			if (parent != -1)
				adjacency.get(parent).add(node);

			final List<Map.Entry<?, ?>> children = new ArrayList<>(((Map<?, ?>) value).entrySet());
			Collections.reverse(children);
			children.forEach(c -> stack.push(Pair.of(c, node)));
		}

		return new TextTree(labels, adjacency);
	}
}

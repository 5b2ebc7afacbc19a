package edu.upf.taln.tted.core.io;

import edu.upf.taln.tted.core.structures.MalformedTreeException;
import edu.upf.taln.tted.core.structures.TextTree;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class TextTreeReaderTest
{
	@Test
	public void testFromNested()
	{
		Map<String, Object> c = new LinkedHashMap<>();
		c.put("e", Map.of());
		Map<String, Object> a = new LinkedHashMap<>();
		a.put("c", c);
		a.put("d", Map.of());
		Map<String, Object> r = new LinkedHashMap<>();
		r.put("a", a);
		r.put("b", Map.of());

		TextTree tree = TextTreeReader.fromNested(Map.of("r", r));
		assertEquals(List.of("r", "a", "c", "e", "d", "b"), tree.getLabels());
		assertEquals(List.of(1, 5), tree.getChildren(0));
		assertEquals(List.of(2, 4), tree.getChildren(1));
		assertEquals(List.of(3), tree.getChildren(2));
		assertEquals(4, tree.getMaxDepth());
	}

	@Test
	public void testReadString()
	{
		TextTree tree = TextTreeReader.readString("{\"Main topic\": {\"First point\": {\"Detail\": {}}, \"Second point\": {}}}");
		assertEquals(List.of("Main topic", "First point", "Detail", "Second point"), tree.getLabels());
		assertEquals("Main topic\n-First point\n--Detail\n-Second point\n", tree.toString());
	}

	@Test
	public void testSingleNode()
	{
		TextTree tree = TextTreeReader.readString("{\"alone\": {}}");
		assertEquals(1, tree.size());
		assertEquals(1, tree.getMaxDepth());
	}

	@Test
	public void testReadFile() throws Exception
	{
		Path path = Paths.get("src/test/resources/trees/reference.json");
		TextTree tree = TextTreeReader.read(path);
		assertEquals(7, tree.size());
		assertEquals(3, tree.getMaxDepth());
		assertEquals("Photosynthesis", tree.getLabel(0));
	}

	@Test(expected = MalformedTreeException.class)
	public void testNoRoot()
	{
		TextTreeReader.readString("{}");
	}

	@Test(expected = MalformedTreeException.class)
	public void testTwoRoots()
	{
		TextTreeReader.readString("{\"a\": {}, \"b\": {}}");
	}

	@Test(expected = MalformedTreeException.class)
	public void testChildrenNotAMapping()
	{
		TextTreeReader.readString("{\"a\": {\"b\": \"c\"}}");
	}

	@Test(expected = MalformedTreeException.class)
	public void testInvalidJson()
	{
		TextTreeReader.readString("{\"a\": {");
	}

	@Test(expected = MalformedTreeException.class)
	public void testNotAnObject()
	{
		TextTreeReader.readString("[\"a\"]");
	}

	@Test(timeout = 5000, expected = MalformedTreeException.class)
	public void testCycle()
	{
		Map<String, Object> children = new LinkedHashMap<>();
		children.put("leaf", Map.of());
		children.put("loop", children);
		TextTreeReader.fromNested(Map.of("root", children));
	}

	@Test(timeout = 5000, expected = MalformedTreeException.class)
	public void testIndirectCycle()
	{
		Map<String, Object> a = new LinkedHashMap<>();
		Map<String, Object> b = new LinkedHashMap<>();
		a.put("b", b);
		b.put("a", a);
		TextTreeReader.fromNested(Map.of("root", a));
	}

	@Test
	public void testSharedChildren()
	{
		Map<String, Object> shared = new LinkedHashMap<>();
		shared.put("leaf", Map.of());
		Map<String, Object> r = new LinkedHashMap<>();
		r.put("a", shared);
		r.put("b", shared);

		TextTree tree = TextTreeReader.fromNested(Map.of("r", r));
		assertEquals(List.of("r", "a", "leaf", "b", "leaf"), tree.getLabels());
		assertEquals(List.of(1, 3), tree.getChildren(0));
	}
}

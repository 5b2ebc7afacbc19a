package edu.upf.taln.tted.core.similarity.vectors;

import edu.upf.taln.tted.core.metric.TreeDistance;
import edu.upf.taln.tted.core.io.TextTreeReader;
import edu.upf.taln.tted.core.similarity.CosineDistance;
import edu.upf.taln.tted.core.structures.TextTree;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class VectorsSentenceEncoderTest
{
	private static final double delta = 1e-9;

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testReadWord2vecFormat() throws Exception
	{
		TextVectors vectors = new TextVectors(Paths.get("src/test/resources/vectors.txt"), Vectors.VectorType.Text_Word2vec);
		assertEquals(3, vectors.getNumDimensions());
		assertTrue(vectors.isDefinedFor("cat"));
		assertFalse(vectors.isDefinedFor("broken")); // wrong number of values
		assertArrayEquals(new double[]{0.8, 0.2, 0.0}, vectors.getVector("dog").orElseThrow(), delta);
		assertFalse(vectors.getVector("unicorn").isPresent());
	}

	@Test
	public void testReadGloveFormat() throws Exception
	{
		TextVectors vectors = new TextVectors(Paths.get("src/test/resources/vectors_glove.txt"), Vectors.VectorType.Text_Glove);
		assertEquals(2, vectors.getNumDimensions());
		assertArrayEquals(new double[]{0.0, 1.0}, vectors.getVector("blue").orElseThrow(), delta);
	}

	@Test(expected = IOException.class)
	public void testGloveHeaderWithoutDimensions() throws Exception
	{
		Path file = folder.newFile("short_header.txt").toPath();
		Files.write(file, List.of("2", "red 1.0 0.0"), StandardCharsets.UTF_8);
		TextVectors.readVectorsFromFile(file, Vectors.VectorType.Text_Glove);
	}

	@Test(expected = IOException.class)
	public void testGloveHeaderWithInvalidDimensions() throws Exception
	{
		Path file = folder.newFile("bad_header.txt").toPath();
		Files.write(file, List.of("2 two", "red 1.0 0.0"), StandardCharsets.UTF_8);
		TextVectors.readVectorsFromFile(file, Vectors.VectorType.Text_Glove);
	}

	@Test
	public void testUnknownVector()
	{
		TextVectors vectors = new TextVectors(Map.of("a", new double[]{1.0}, "<unk>", new double[]{-1.0}));
		assertArrayEquals(new double[]{-1.0}, vectors.getVector("zzz").orElseThrow(), delta);
	}

	@Test
	public void testEncode()
	{
		TextVectors vectors = new TextVectors(Map.of(
				"cat", new double[]{1.0, 0.0},
				"sat", new double[]{0.0, 1.0}));
		VectorsSentenceEncoder encoder = new VectorsSentenceEncoder(vectors);

		List<double[]> embeddings = encoder.encode(List.of("The cat sat", "CAT", "", "nothing known"));
		assertEquals(4, embeddings.size());
		assertArrayEquals(new double[]{0.5, 0.5}, embeddings.get(0), delta);
		assertArrayEquals(new double[]{1.0, 0.0}, embeddings.get(1), delta);
		assertArrayEquals(new double[]{0.0, 0.0}, embeddings.get(2), delta);
		assertArrayEquals(new double[]{0.0, 0.0}, embeddings.get(3), delta);
	}

	@Test
	public void testTreeDistanceWithVectors() throws Exception
	{
		TextVectors vectors = new TextVectors(Paths.get("src/test/resources/vectors.txt"), Vectors.VectorType.Text_Word2vec);
		TreeDistance metric = new TreeDistance(new VectorsSentenceEncoder(vectors), new CosineDistance());
		TextTree t1 = TextTreeReader.readString("{\"cat\": {\"sat\": {}}}");
		TextTree t2 = TextTreeReader.readString("{\"dog\": {\"sat\": {}}}");
		TextTree t3 = TextTreeReader.readString("{\"mat\": {\"cat\": {}}}");

		double close = metric.compare(t1, t2, true, true, false, null);
		double far = metric.compare(t1, t3, true, true, false, null);
		assertEquals(0.0, metric.compare(t1, t1, true, true, false, null), delta);
		assertTrue(close > 0.0);
		assertTrue(close < far);
		assertTrue(far < 1.0);
	}
}

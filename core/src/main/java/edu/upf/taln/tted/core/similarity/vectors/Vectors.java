package edu.upf.taln.tted.core.similarity.vectors;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Word vectors indexed by item, typically lower-cased tokens.
 */
public abstract class Vectors
{
	// Keys commonly used by pretrained embeddings for out-of-vocabulary items
	private static final List<String> unknown_keys = List.of("UNKNOWN", "UUUNKKK", "UNK", "*UNKNOWN*", "<unk>");

	public abstract boolean isDefinedFor(String item);
	public abstract int getNumDimensions();

	/**
	 * @return vector of the item, or the vector for unknown items if there is one and the item is not defined
	 */
	public abstract Optional<double[]> getVector(String item);

	protected static Optional<double[]> getUnknownVector(Function<String, Optional<double []>> lookup)
	{
		return unknown_keys.stream()
				.map(lookup)
				.flatMap(Optional::stream)
				.findFirst();
	}

	// Text_Glove -> with header containing num vectors and dimensions, Text_Word2vec -> without header
	public enum VectorType {Text_Glove, Text_Word2vec}
}

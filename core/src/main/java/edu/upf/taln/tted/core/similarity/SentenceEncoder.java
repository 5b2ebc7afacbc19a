package edu.upf.taln.tted.core.similarity;

import java.util.List;

/**
 * Maps texts to embeddings, e.g. a sentence transformer running locally or behind a remote service.
 * Implementations may be expensive to call, so callers batch all the texts they need in a single call.
 */
@FunctionalInterface
public interface SentenceEncoder
{
	/**
	 * @param sentences texts to encode, possibly including the empty string
	 * @return one embedding per text, in the same order
	 */
	List<double[]> encode(List<String> sentences);
}

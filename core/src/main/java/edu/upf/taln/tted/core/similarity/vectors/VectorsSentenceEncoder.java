package edu.upf.taln.tted.core.similarity.vectors;

import edu.upf.taln.tted.core.similarity.SentenceEncoder;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Bag-of-words sentence encoder: each text is encoded as the arithmetic average of the vectors of its lower-cased
 * whitespace-separated tokens. Texts without any known token, the empty string among them, get a zero vector.
 * Thread-safe if the underlying vectors are.
 */
public class VectorsSentenceEncoder implements SentenceEncoder
{
	private final Vectors word_vectors;

	public VectorsSentenceEncoder(Vectors word_vectors)
	{
		this.word_vectors = word_vectors;
	}

	@Override
	public List<double[]> encode(List<String> sentences)
	{
		return sentences.stream()
				.map(this::encode)
				.collect(Collectors.toList());
	}

	// calculates arithmetic average of vectors of tokens
	public double[] encode(String sentence)
	{
		final List<double[]> vectors = tokenize(sentence).stream()
				.map(word_vectors::getVector)
				.filter(Optional::isPresent)
				.map(Optional::get)
				.collect(Collectors.toList());

		if (vectors.isEmpty())
			return new double[word_vectors.getNumDimensions()];
		else if (vectors.size() == 1)
			return vectors.get(0).clone();

		return IntStream.range(0, word_vectors.getNumDimensions())
				.mapToDouble(i -> vectors.stream()
						.mapToDouble(v -> v[i])
						.average().orElse(0.0))
				.toArray();
	}

	private static List<String> tokenize(String sentence)
	{
		return List.of(StringUtils.split(sentence.toLowerCase(Locale.ROOT)));
	}
}

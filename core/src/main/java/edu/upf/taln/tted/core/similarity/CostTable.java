package edu.upf.taln.tted.core.similarity;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import edu.upf.taln.tted.core.structures.TextTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Edit costs for a pair of trees derived from the embeddings of their labels.
 * Substitution costs are the distances between the embeddings of a label of the first tree and a label of the second
 * tree. Unary costs, used for deletions and insertions, are the distances between the embedding of a label and the
 * embedding of the empty string.
 * Costs are memoized per distinct label text within a single comparison call: nodes sharing a label share costs.
 * Immutable class.
 */
public final class CostTable
{
	private final ImmutableTable<String, String, Double> substitution;
	private final ImmutableMap<String, Double> unary;
	private final static Logger log = LogManager.getLogger();

	private CostTable(Table<String, String, Double> substitution, Map<String, Double> unary)
	{
		this.substitution = ImmutableTable.copyOf(substitution);
		this.unary = ImmutableMap.copyOf(unary);
	}

	/**
	 * Encodes the distinct labels of both trees in a single call to the encoder, plus a second call for the empty
	 * string. The encoder is not called at all if both trees are empty.
	 * Exceptions thrown by the encoder or by the distance function are propagated unchanged.
	 */
	public static CostTable build(TextTree tree1, TextTree tree2, SentenceEncoder encoder, EmbeddingDistance distance)
	{
		final Set<String> labels1 = new LinkedHashSet<>(tree1.getLabels());
		final Set<String> labels2 = new LinkedHashSet<>(tree2.getLabels());
		final Set<String> all_labels = new LinkedHashSet<>(labels1);
		all_labels.addAll(labels2);
		if (all_labels.isEmpty())
			return new CostTable(HashBasedTable.create(), Map.of());

		final Stopwatch timer = Stopwatch.createStarted();
		final List<String> sentences = new ArrayList<>(all_labels);
		final List<double[]> embeddings = encoder.encode(sentences);
		final Map<String, double[]> label2embedding = new HashMap<>();
		for (int i = 0; i < sentences.size(); ++i)
			label2embedding.put(sentences.get(i), embeddings.get(i));
		final double[] empty_embedding = encoder.encode(List.of("")).get(0);
		log.debug("Encoded " + sentences.size() + " labels in " + timer);

		final Table<String, String, Double> substitution = HashBasedTable.create();
		for (String l1 : labels1)
			for (String l2 : labels2)
				substitution.put(l1, l2, distance.apply(label2embedding.get(l1), label2embedding.get(l2)));

		final Map<String, Double> unary = new HashMap<>();
		for (String l : all_labels)
			unary.put(l, distance.apply(label2embedding.get(l), empty_embedding));

		log.debug("Cost table for " + labels1.size() + "x" + labels2.size() + " labels built in " + timer.stop());
		return new CostTable(substitution, unary);
	}

	public double getSubstitutionCost(String label1, String label2)
	{
		final Double cost = substitution.get(label1, label2);
		Preconditions.checkState(cost != null, "No substitution cost for labels \"%s\" and \"%s\"", label1, label2);
		return cost;
	}

	public double getUnaryCost(String label)
	{
		final Double cost = unary.get(label);
		Preconditions.checkState(cost != null, "No deletion/insertion cost for label \"%s\"", label);
		return cost;
	}

	/**
	 * @return highest unary cost among the labels of both trees, 0 if both are empty
	 */
	public double getMaxUnaryCost()
	{
		return unary.values().stream()
				.mapToDouble(Double::doubleValue)
				.max().orElse(0.0);
	}
}

package org.springaicommunity.github.triage;

import java.util.List;

/**
 * Computes a semantic vector for a piece of text.
 */
public interface EmbeddingProvider {

	/**
	 * The model name, part of every cache key.
	 */
	String model();

	/**
	 * Embed sanitized text.
	 * @param text the text to embed
	 * @return the embedding vector
	 * @throws EmbeddingUnavailableException if no embedding could be produced
	 */
	List<Double> embed(String text);

}

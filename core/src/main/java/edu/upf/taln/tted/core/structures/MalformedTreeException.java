package edu.upf.taln.tted.core.structures;

/**
 * Signals input that does not describe a single rooted tree: no root or several roots, nodes with more than one
 * parent, cycles, or nested data that does not follow the one-key-per-subtree exchange format.
 */
public class MalformedTreeException extends RuntimeException
{
	public MalformedTreeException(String message)
	{
		super(message);
	}

	public MalformedTreeException(String message, Throwable cause)
	{
		super(message, cause);
	}
}

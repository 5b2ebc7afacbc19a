package edu.upf.taln.tted.core;

public class Options
{
	public boolean normalize = false; // rescale distances to [0,1) using the largest deletion cost of the compared trees
	public boolean unordered = true; // if true, order of siblings is ignored
	public boolean use_context = false; // if true, labels are prefixed with the labels of their ancestors before encoding
	public Integer depth_limit = null; // if set, trees are truncated to this depth. Values >= 1
	public String context_separator = " "; // separates ancestor labels when use_context is true
	public boolean parallel = false; // if true, depth-averaged distances compute each depth concurrently

	public Options() {}

	public Options(Options o)
	{
		this.normalize = o.normalize;
		this.unordered = o.unordered;
		this.use_context = o.use_context;
		this.depth_limit = o.depth_limit;
		this.context_separator = o.context_separator;
		this.parallel = o.parallel;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\tnormalize = " + normalize +
				"\n\tunordered = " + unordered +
				"\n\tuse_context = " + use_context +
				"\n\tdepth_limit = " + (depth_limit == null ? "none" : depth_limit) +
				"\n\tcontext_separator = \"" + context_separator + "\"" +
				"\n\tparallel = " + parallel;
	}
}

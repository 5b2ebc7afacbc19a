package edu.upf.taln.tted.tools;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	/**
	 * Parses depth limits and similar counts, rejecting anything that is not a positive integer.
	 */
	public static class PositiveIntegerConverter implements IStringConverter<Integer>
	{
		private final String name;

		public PositiveIntegerConverter(String name)
		{
			this.name = name;
		}

		@Override
		public Integer convert(String value)
		{
			final int n;
			try
			{
				n = Integer.parseInt(value.trim());
			}
			catch (NumberFormatException e)
			{
				throw new ParameterException("Value of " + name + " is not an integer: " + value);
			}
			if (n < 1)
				throw new ParameterException("Value of " + name + " must be greater than 0: " + value);
			return n;
		}
	}

	public static class ValidPathToFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isDirectory(path)) || path.getParent() == null || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot write to file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.isRegularFile(path) || !Files.isReadable(path))
			{
				throw new ParameterException("Cannot read file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFolder implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.isDirectory(path) || !Files.isReadable(path))
			{
				throw new ParameterException("Cannot read folder " + name + " = " + value);
			}
		}
	}

}

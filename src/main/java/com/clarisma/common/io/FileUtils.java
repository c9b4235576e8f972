/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.io;

import java.io.File;
import java.io.IOException;
import java.io.FileOutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class FileUtils 
{
	public static Path addExtension(Path path, String ext)
	{
		if(!ext.startsWith(".")) ext = "." + ext;
		Path parent = path.toAbsolutePath().getParent();
		return parent.resolve(path.getFileName() + ext);
	}

	private static int indexOfExtension(String path)
	{
		int lastDot = path.lastIndexOf('.');
		int lastSeparator = path.lastIndexOf(File.separatorChar);
		return lastDot > lastSeparator ? lastDot : -1;
	}

	public static String getExtension(String path)
	{
		int n = indexOfExtension(path);
		return n < 0 ? "" : path.substring(n+1);
	}

	public static String pathWithDefaultExtension(String path, String defaultExt)
	{
		String ext = getExtension(path);
		if(!ext.isEmpty()) return path;
		return defaultExt.startsWith(".") ? path + defaultExt : path+'.'+defaultExt;
	}

	/**
	 * Reads the contents of a file.
	 *
	 * @param path	the file to read
	 * @return the file's bytes, or `null` if the file does not exist
	 * @throws IOException if the file exists but cannot be read
	 */
	public static byte[] readIfExists(Path path) throws IOException
	{
		try
		{
			return Files.readAllBytes(path);
		}
		catch(NoSuchFileException ex)
		{
			return null;
		}
	}

	/**
	 * Replaces the contents of a file in a way that never leaves a partially
	 * written file behind: the data is written to `<path>.tmp`, forced to disk,
	 * and then moved over `path`. If the process dies before the move, the
	 * previous version of the file is untouched.
	 *
	 * @param path	the file to write
	 * @param data	the new contents
	 * @throws IOException
	 */
	public static void writeAtomic(Path path, byte[] data) throws IOException
	{
		Path tempPath = addExtension(path, ".tmp");
		try(FileOutputStream out = new FileOutputStream(tempPath.toFile()))
		{
			out.write(data);
			out.getFD().sync();
		}
		try
		{
			Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE,
				StandardCopyOption.REPLACE_EXISTING);
		}
		catch(AtomicMoveNotSupportedException ex)
		{
			Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}

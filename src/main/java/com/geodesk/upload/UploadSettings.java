/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload;

import com.geodesk.upload.changeset.UploadLimits;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings of an upload run. Defaults can be overridden by a settings
 * file (in `.properties` format) and by command-line options, using the
 * same names:
 *
 * api                  - URL of the OSM API server
 * user-agent           - sent with each request, and used as the
 *                        `created_by` tag of each changeset
 * diffset-size         - maximum number of entities per upload request
 * changeset-size       - maximum number of entities per changeset
 * max-way-nodes        - ways with more nodes are rejected
 * max-relation-members - relations with more members are rejected
 */
public class UploadSettings
{
	public static final String DEFAULT_API_URL = "https://api.openstreetmap.org";
	public static final String DEFAULT_USER_AGENT =
		"osm-bulk-upload/" + UploadTool.VERSION + " Java/" + System.getProperty("java.version");

	private String apiUrl = DEFAULT_API_URL;
	private String userAgent = DEFAULT_USER_AGENT;
	private int diffsetSize = UploadLimits.DEFAULT_DIFFSET_SIZE;
	private int changesetSize = UploadLimits.DEFAULT_CHANGESET_SIZE;
	private int maxWayNodes = UploadLimits.DEFAULT_MAX_WAY_NODES;
	private int maxRelationMembers = UploadLimits.DEFAULT_MAX_RELATION_MEMBERS;

	private static void error(String msg, Object... args)
	{
		throw new IllegalArgumentException(String.format(msg, args));
	}

	public static void checkRange(long val, long min, long max)
	{
		if (val < min)
		{
			error("Must not be less than %,d", min);
		}
		if (val > max)
		{
			error("Must not be greater than %,d", max);
		}
	}

	private static int parseInt(String value)
	{
		try
		{
			return Integer.parseInt(value.trim().replace("_", ""));
		}
		catch(NumberFormatException ex)
		{
			throw new IllegalArgumentException("Must be a number, not \"" + value + "\"");
		}
	}

	public String apiUrl()
	{
		return apiUrl;
	}

	public void apiUrl(String url)
	{
		if(!url.startsWith("http://") && !url.startsWith("https://"))
		{
			error("Not an HTTP(S) URL: %s", url);
		}
		apiUrl = url;
	}

	public String userAgent()
	{
		return userAgent;
	}

	public void userAgent(String userAgent)
	{
		if(userAgent.isBlank()) error("Must not be blank");
		this.userAgent = userAgent;
	}

	public int diffsetSize()
	{
		return diffsetSize;
	}

	public void diffsetSize(int size)
	{
		checkRange(size, 1, 10_000);
		diffsetSize = size;
	}

	public int changesetSize()
	{
		return changesetSize;
	}

	public void changesetSize(int size)
	{
		checkRange(size, 1, UploadLimits.DEFAULT_CHANGESET_SIZE);
		changesetSize = size;
	}

	public int maxWayNodes()
	{
		return maxWayNodes;
	}

	public void maxWayNodes(int count)
	{
		checkRange(count, 2, 100_000);
		maxWayNodes = count;
	}

	public int maxRelationMembers()
	{
		return maxRelationMembers;
	}

	public void maxRelationMembers(int count)
	{
		checkRange(count, 1, 1_000_000);
		maxRelationMembers = count;
	}

	/**
	 * Changes a setting by name.
	 *
	 * @return false if there is no setting with the given name
	 * @throws IllegalArgumentException if the value is not valid
	 */
	public boolean set(String name, String value)
	{
		try
		{
			switch (name)
			{
			case "api":
				apiUrl(value);
				return true;
			case "user-agent":
				userAgent(value);
				return true;
			case "diffset-size":
				diffsetSize(parseInt(value));
				return true;
			case "changeset-size":
				changesetSize(parseInt(value));
				return true;
			case "max-way-nodes":
				maxWayNodes(parseInt(value));
				return true;
			case "max-relation-members":
				maxRelationMembers(parseInt(value));
				return true;
			}
		}
		catch(IllegalArgumentException ex)
		{
			throw new IllegalArgumentException(name + ": " + ex.getMessage(), ex);
		}
		return false;
	}

	public void read(InputStream in, String source) throws IOException
	{
		Properties props = new Properties();
		try(Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8))
		{
			props.load(reader);
		}
		for(String name: props.stringPropertyNames())
		{
			if(!set(name, props.getProperty(name)))
			{
				error("%s: Unknown setting \"%s\"", source, name);
			}
		}
	}

	public void read(Path path) throws IOException
	{
		try(InputStream in = Files.newInputStream(path))
		{
			read(in, path.toString());
		}
	}

	public UploadLimits limits()
	{
		return new UploadLimits(diffsetSize, changesetSize, maxWayNodes, maxRelationMembers);
	}
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload;

import com.clarisma.common.cli.BasicCommand;
import com.clarisma.common.cli.CommandConfigurator;
import com.clarisma.common.cli.Option;
import com.clarisma.common.cli.Parameter;
import com.clarisma.common.cli.Verbosity;
import com.clarisma.common.io.FileUtils;
import com.geodesk.upload.api.HttpOsmApi;
import com.geodesk.upload.api.OsmApi;
import com.geodesk.upload.changeset.ProgressReporter;
import com.geodesk.upload.changeset.UploadSummary;
import com.geodesk.upload.changeset.Uploader;
import com.geodesk.upload.idmap.FileIdMapStorage;
import com.geodesk.upload.idmap.IdMap;
import com.geodesk.upload.osm.OsmDocument;
import com.geodesk.upload.osm.OsmReader;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uploads an OSM file. The IDs assigned by the server are kept in an
 * ID map (by default `<input>.db`), so an interrupted upload can be
 * resumed by running the command again with the same input file.
 */
public class UploadCommand extends BasicCommand
{
    private Path inputPath;
    private Path idMapPath;
    private Path configPath;
    private final Map<String,String> settingOverrides = new LinkedHashMap<>();
    private final Map<String,String> extraTags = new LinkedHashMap<>();

    @Option("user,u=name: OSM user name")
    protected String user;

    @Option("password,p=password: OSM password")
    protected String password;

    @Option("token=token: OAuth 2.0 access token (instead of user/password)")
    protected String token;

    @Option("comment,c=text: changeset comment")
    protected String comment;

    @Option("help,?")
    protected boolean helpRequested;

    @Parameter("0=?input")
    public void input(String filename)
    {
        inputPath = Path.of(FileUtils.pathWithDefaultExtension(filename, ".osm"));
    }

    @Option("input,i=file: the .osm (or .osm.gz) file to upload")
    public void inputOption(String filename)
    {
        input(filename);
    }

    @Option("id-map,m=file: ID map file (default: <input>.db)")
    public void idMap(String filename)
    {
        idMapPath = Path.of(filename);
    }

    @Option("config=file: settings file (.properties)")
    public void configFile(String filename)
    {
        configPath = Path.of(filename);
    }

    @Option("api=url: API server (default: " + UploadSettings.DEFAULT_API_URL + ")")
    public void api(String url)
    {
        settingOverrides.put("api", url);
    }

    @Option("diffset-size=number: maximum entities per upload")
    public void diffsetSize(String size)
    {
        settingOverrides.put("diffset-size", size);
    }

    @Option("changeset-size=number: maximum entities per changeset")
    public void changesetSize(String size)
    {
        settingOverrides.put("changeset-size", size);
    }

    @Option("max-way-nodes=number: reject ways with more nodes")
    public void maxWayNodes(String count)
    {
        settingOverrides.put("max-way-nodes", count);
    }

    @Option("max-relation-members=number: reject relations with more members")
    public void maxRelationMembers(String count)
    {
        settingOverrides.put("max-relation-members", count);
    }

    @Option("tag,t=key=value: additional changeset tag (may be repeated)")
    public void tag(String keyValue)
    {
        int n = keyValue == null ? -1 : keyValue.indexOf('=');
        if(n <= 0) throw new IllegalArgumentException("Must be key=value");
        extraTags.put(keyValue.substring(0, n), keyValue.substring(n+1));
    }

    Path idMapPath()
    {
        return idMapPath != null ? idMapPath : FileUtils.addExtension(inputPath, ".db");
    }

    UploadSettings settings() throws Exception
    {
        UploadSettings settings = new UploadSettings();
        if(configPath != null) settings.read(configPath);
        for(Map.Entry<String,String> e: settingOverrides.entrySet())
        {
            settings.set(e.getKey(), e.getValue());
        }
        return settings;
    }

    Map<String,String> changesetTags(UploadSettings settings)
    {
        Map<String,String> tags = new LinkedHashMap<>();
        tags.put("created_by", settings.userAgent());
        tags.put("comment", comment);
        tags.putAll(extraTags);
        return tags;
    }

    private void checkArguments()
    {
        if(inputPath == null)
        {
            throw new IllegalArgumentException("<input>: Missing argument");
        }
        if(comment == null || comment.isBlank())
        {
            throw new IllegalArgumentException("Option --comment (-c) is required");
        }
        if(token == null && (user == null || password == null))
        {
            throw new IllegalArgumentException(
                "Specify --user (-u) and --password (-p), or --token");
        }
    }

    private void configureLogging()
    {
        Level level;
        if(verbosity >= Verbosity.DEBUG)
        {
            level = Level.DEBUG;
        }
        else if(verbosity >= Verbosity.VERBOSE)
        {
            level = Level.INFO;
        }
        else if(verbosity > Verbosity.SILENT)
        {
            level = Level.WARN;
        }
        else
        {
            level = Level.OFF;
        }
        Configurator.setRootLevel(level);
    }

    protected OsmApi createApi(UploadSettings settings)
    {
        String authorization = token != null ? HttpOsmApi.bearerAuth(token) :
            HttpOsmApi.basicAuth(user, password);
        return new HttpOsmApi(settings.apiUrl(), settings.userAgent(), authorization);
    }

    @Override public int perform() throws Exception
    {
        if(helpRequested)
        {
            System.err.println("Usage: osm-bulk-upload upload <input> [options]\n");
            System.err.print(new CommandConfigurator(this).describeOptions());
            return 0;
        }
        configureLogging();
        checkArguments();
        UploadSettings settings = settings();

        if(verbosity >= Verbosity.NORMAL) System.err.format("Reading %s ...\r", inputPath);
        OsmDocument doc = new OsmReader().read(inputPath);
        if(verbosity >= Verbosity.NORMAL)
        {
            System.err.format("Read %,d nodes, %,d ways, %,d relations\n",
                doc.nodes().size(), doc.ways().size(), doc.relations().size());
        }

        IdMap idMap = new IdMap(new FileIdMapStorage(idMapPath()));
        idMap.load();
        if(idMap.pendingUpload() != null && verbosity >= Verbosity.QUIET)
        {
            System.err.format("Warning: The previous run was interrupted during the %s.\n" +
                "Its entities may have been uploaded already; check the changeset " +
                "before continuing.\n", idMap.pendingUpload());
        }

        ProgressReporter progress = verbosity >= Verbosity.NORMAL ?
            new ProgressReporter(System.err, "entities", "Uploading", "Uploaded") : null;
        UploadSummary summary;
        try(OsmApi api = createApi(settings))
        {
            Uploader uploader = new Uploader(api, idMap, settings.limits(), progress);
            summary = uploader.run(doc, changesetTags(settings));
        }
        if(verbosity >= Verbosity.NORMAL) System.err.println(summary);
        return 0;
    }

    @Override public int error(Throwable ex)
    {
        return ErrorReporter.report(ex, verbosity);
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload;

import com.clarisma.common.cli.Application;

public class UploadTool extends Application
{
    public static final String VERSION = "0.1.0";

    @Override public String version()
    {
        return "osm-bulk-upload " + VERSION;
    }

    @Override public String description()
    {
        return
            "osm-bulk-upload - Upload large OSM files to the OSM API\n\n" +
            "Usage: osm-bulk-upload <command> [options]\n\n" +
            "Commands:\n\n" +
            "  upload - Upload the entities of an .osm file\n" +
            "\n" +
            "Use \"osm-bulk-upload upload --help\" for the list of options.";
    }

    @Override protected int error(Throwable ex, int verbosity)
    {
        return ErrorReporter.report(ex, verbosity);
    }

    public static void main(String[] args)
    {
        UploadTool app = new UploadTool();
        System.exit(app.run(null, args));
    }
}

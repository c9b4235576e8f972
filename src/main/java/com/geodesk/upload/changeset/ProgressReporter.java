/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

import java.io.PrintStream;

/**
 * Reports upload progress as a percentage of the entities to be uploaded.
 */
public class ProgressReporter
{
    private final PrintStream out;
    private final String progressVerb;
    private final String resultVerb;
    private final String unitsNoun;
    private final long startTime;
    private long totalUnits;
    private long unitsProcessed;
    private int percentageReported = -1;

    public ProgressReporter(PrintStream out, String unitsNoun, String progressVerb, String resultVerb)
    {
        this.out = out;
        this.progressVerb = progressVerb;
        this.unitsNoun = unitsNoun;
        this.resultVerb = resultVerb;
        startTime = System.currentTimeMillis();
    }

    public void start(long totalUnits)
    {
        this.totalUnits = totalUnits;
        unitsProcessed = 0;
        percentageReported = -1;
    }

    public void progress(long units)
    {
        unitsProcessed += units;
        if(progressVerb == null || totalUnits == 0) return;
        int percentageCompleted = (int)(unitsProcessed * 100 / totalUnits);
        if (percentageCompleted != percentageReported)
        {
            out.format("%s... %d%%\r", progressVerb, percentageCompleted);
            percentageReported = percentageCompleted;
        }
    }

    public void finished()
    {
        if(resultVerb != null)
        {
            long endTime = System.currentTimeMillis();
            out.format("%s %,d %s in %s\n", resultVerb, unitsProcessed,
                unitsNoun, formatTimespan(endTime - startTime));
        }
    }

    static String formatTimespan(long millis)
    {
        long seconds = millis / 1000;
        if(seconds < 60) return String.format("%d.%03ds", seconds, millis % 1000);
        long minutes = seconds / 60;
        if(minutes < 60) return String.format("%dm %02ds", minutes, seconds % 60);
        return String.format("%dh %02dm", minutes / 60, minutes % 60);
    }
}

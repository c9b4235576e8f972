package com.geodesk.upload.api;

import com.geodesk.upload.model.OsmEntity;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An in-memory OsmApi that records every call. Created and modified
 * entities receive consecutive IDs starting at 1000.
 */
public class FakeOsmApi implements OsmApi
{
    public static class Upload
    {
        public final long changesetId;
        public final List<OsmEntity> creates;
        public final List<OsmEntity> modifies;
        public final List<OsmEntity> deletes;

        Upload(long changesetId, List<OsmEntity> creates,
            List<OsmEntity> modifies, List<OsmEntity> deletes)
        {
            this.changesetId = changesetId;
            this.creates = new ArrayList<>(creates);
            this.modifies = new ArrayList<>(modifies);
            this.deletes = new ArrayList<>(deletes);
        }

        public int size()
        {
            return creates.size() + modifies.size() + deletes.size();
        }

        public List<OsmEntity> all()
        {
            List<OsmEntity> list = new ArrayList<>(creates);
            list.addAll(modifies);
            list.addAll(deletes);
            return list;
        }
    }

    public final List<Map<String,String>> openedChangesets = new ArrayList<>();
    public final List<Upload> uploads = new ArrayList<>();
    public final List<Long> closedChangesets = new ArrayList<>();
    /** Every call, in order, e.g. "create 1", "upload 1 (1000)", "close 1" */
    public final List<String> calls = new ArrayList<>();

    public boolean failCreate;
    public boolean failClose;
    /** The upload with this index (starting at 0) is rejected */
    public int failUploadAt = -1;
    /** HTTP status of the rejected upload; 0 for a lost connection */
    public int failUploadStatus = 409;
    public boolean closed;

    private long nextChangesetId = 1;
    private long nextEntityId = 1000;

    @Override public long createChangeset(Map<String,String> tags) throws ApiException
    {
        if(failCreate) throw new ApiException("Error creating changeset", 401, "Unauthorized");
        long id = nextChangesetId++;
        openedChangesets.add(tags);
        calls.add("create " + id);
        return id;
    }

    @Override public List<DiffResult> uploadDiff(long changesetId, List<OsmEntity> creates,
        List<OsmEntity> modifies, List<OsmEntity> deletes) throws ApiException
    {
        if(uploads.size() == failUploadAt)
        {
            failUploadAt = -1;
            if(failUploadStatus == 0)
            {
                throw new ApiException("Error uploading diff",
                    new IOException("Connection reset"));
            }
            throw new ApiException("Error uploading diff", failUploadStatus, "Changeset conflict");
        }
        Upload upload = new Upload(changesetId, creates, modifies, deletes);
        uploads.add(upload);
        calls.add("upload " + changesetId + " (" + upload.size() + ")");
        List<DiffResult> results = new ArrayList<>();
        for(OsmEntity e: creates)
        {
            results.add(DiffResult.mapped(e.type(), e.id(), nextEntityId++, 1));
        }
        for(OsmEntity e: modifies)
        {
            results.add(DiffResult.mapped(e.type(), e.id(), e.id(), 2));
        }
        for(OsmEntity e: deletes)
        {
            results.add(DiffResult.deleted(e.type(), e.id()));
        }
        return results;
    }

    @Override public void closeChangeset(long changesetId) throws ApiException
    {
        calls.add("close " + changesetId);
        if(failClose) throw new ApiException("Error closing changeset", 409, "Already closed");
        closedChangesets.add(changesetId);
    }

    @Override public void close()
    {
        closed = true;
    }

    public List<OsmEntity> uploadedEntities()
    {
        List<OsmEntity> list = new ArrayList<>();
        for(Upload u: uploads) list.addAll(u.all());
        return list;
    }
}

/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.api;

import com.geodesk.upload.model.OsmEntity;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpPut;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Talks to an OSM API 0.6 server over HTTP(S).
 */
public class HttpOsmApi implements OsmApi
{
    private static final Logger log = LogManager.getLogger();

    private static final int HTTP_OK = 200;
    private static final ContentType XML = ContentType.create("text/xml", StandardCharsets.UTF_8);

    private final String baseUrl;
    private final String userAgent;
    private final String authorization;
    private final CloseableHttpClient httpClient;
    private final ChangeWriter changeWriter;

    /**
     * @param apiUrl        the server, e.g. `https://api.openstreetmap.org`
     * @param userAgent     sent as `User-Agent`, and used as the `generator`
     *                      of uploaded documents
     * @param authorization value of the `Authorization` header
     *                      (see {@link #basicAuth} and {@link #bearerAuth})
     */
    public HttpOsmApi(String apiUrl, String userAgent, String authorization)
    {
        String url = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length()-1) : apiUrl;
        baseUrl = url + "/api/0.6/changeset/";
        this.userAgent = userAgent;
        this.authorization = authorization;
        httpClient = HttpClients.createDefault();
        changeWriter = new ChangeWriter(userAgent);
    }

    public static String basicAuth(String user, String password)
    {
        String credentials = user + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(
            credentials.getBytes(StandardCharsets.UTF_8));
    }

    public static String bearerAuth(String token)
    {
        return "Bearer " + token;
    }

    String url(String path)
    {
        return baseUrl + path;
    }

    private String send(HttpUriRequestBase request, String body, String what) throws ApiException
    {
        request.setHeader("User-Agent", userAgent);
        if(authorization != null) request.setHeader("Authorization", authorization);
        if(body != null) request.setEntity(new StringEntity(body, XML));

        log.debug("{} {}", request.getMethod(), request.getRequestUri());
        try(ClassicHttpResponse response = httpClient.executeOpen(null, request, null))
        {
            HttpEntity entity = response.getEntity();
            String responseBody = entity == null ? "" :
                EntityUtils.toString(entity, StandardCharsets.UTF_8);
            int status = response.getCode();
            if(status != HTTP_OK)
            {
                log.debug("{} failed with status {}: {}", what, status, responseBody);
                throw new ApiException("Error " + what, status, responseBody);
            }
            return responseBody;
        }
        catch(ApiException ex)
        {
            throw ex;
        }
        catch(IOException | ParseException ex)
        {
            throw new ApiException("Error " + what, ex);
        }
    }

    @Override public long createChangeset(Map<String,String> tags) throws ApiException
    {
        String response = send(new HttpPut(url("create")),
            changeWriter.changesetXml(tags), "creating changeset");
        try
        {
            return Long.parseLong(response.trim());
        }
        catch(NumberFormatException ex)
        {
            throw new ApiException("Server returned an invalid changeset ID: " + response,
                HTTP_OK, response);
        }
    }

    @Override public List<DiffResult> uploadDiff(long changesetId, List<OsmEntity> creates,
        List<OsmEntity> modifies, List<OsmEntity> deletes) throws ApiException
    {
        String what = "uploading to changeset " + changesetId;
        String response = send(new HttpPost(url(changesetId + "/upload")),
            changeWriter.diffXml(creates, modifies, deletes), what);
        try
        {
            return new DiffResultReader().read(response);
        }
        catch(IOException ex)
        {
            throw new ApiException("Error " + what, ex);
        }
    }

    @Override public void closeChangeset(long changesetId) throws ApiException
    {
        send(new HttpPut(url(changesetId + "/close")), null,
            "closing changeset " + changesetId);
    }

    @Override public void close() throws IOException
    {
        httpClient.close();
    }
}

package com.geodesk.upload.api;

import com.geodesk.upload.model.Action;
import com.geodesk.upload.model.EntityType;
import com.geodesk.upload.model.OsmEntity;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class HttpOsmApiTest
{
    private HttpServer server;
    private String serverUrl;
    private final List<String> requests = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();
    private final List<String> authorizations = new ArrayList<>();
    private int status = 200;
    private String response = "";

    @Before public void setUp() throws IOException
    {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        serverUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @After public void tearDown()
    {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException
    {
        synchronized (requests)
        {
            requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
            try(InputStream in = exchange.getRequestBody())
            {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try(OutputStream out = exchange.getResponseBody())
        {
            out.write(bytes);
        }
    }

    private HttpOsmApi api()
    {
        return new HttpOsmApi(serverUrl, "osm-bulk-upload/test",
            HttpOsmApi.basicAuth("alice", "secret"));
    }

    @Test public void testAuthorization()
    {
        // "alice:secret" in Base64
        assertEquals("Basic YWxpY2U6c2VjcmV0", HttpOsmApi.basicAuth("alice", "secret"));
        assertEquals("Bearer abc123", HttpOsmApi.bearerAuth("abc123"));
    }

    @Test public void testUrl() throws IOException
    {
        try(HttpOsmApi api = new HttpOsmApi("https://master.apis.dev.openstreetmap.org/",
            "test", null))
        {
            assertEquals("https://master.apis.dev.openstreetmap.org/api/0.6/changeset/create",
                api.url("create"));
        }
    }

    @Test public void testCreateChangeset() throws IOException
    {
        response = "4711\n";
        try(HttpOsmApi api = api())
        {
            long id = api.createChangeset(Collections.singletonMap("comment", "Benches"));
            assertEquals(4711, id);
        }
        assertEquals(List.of("PUT /api/0.6/changeset/create"), requests);
        assertEquals("Basic YWxpY2U6c2VjcmV0", authorizations.get(0));
        assertTrue(bodies.get(0).contains("<tag k=\"comment\" v=\"Benches\"/>"));
    }

    @Test public void testUploadDiff() throws IOException
    {
        response = "<diffResult version=\"0.6\">" +
            "<node old_id=\"-1\" new_id=\"900\" new_version=\"1\"/></diffResult>";
        OsmEntity node = new OsmEntity(EntityType.NODE, -1, Action.CREATE);
        node.changeset(4711);
        List<DiffResult> results;
        try(HttpOsmApi api = api())
        {
            results = api.uploadDiff(4711, List.of(node), List.of(), List.of());
        }
        assertEquals(List.of("POST /api/0.6/changeset/4711/upload"), requests);
        assertTrue(bodies.get(0).contains("<node id=\"-1\" changeset=\"4711\"/>"));
        assertEquals(1, results.size());
        assertEquals(900, results.get(0).newId());
    }

    @Test public void testCloseChangeset() throws IOException
    {
        try(HttpOsmApi api = api())
        {
            api.closeChangeset(4711);
        }
        assertEquals(List.of("PUT /api/0.6/changeset/4711/close"), requests);
    }

    @Test public void testErrorResponse() throws IOException
    {
        status = 409;
        response = "The changeset 4711 was closed at 2024-03-01 10:00:00 UTC";
        try(HttpOsmApi api = api())
        {
            api.closeChangeset(4711);
            fail("Expected ApiException");
        }
        catch(ApiException ex)
        {
            assertEquals(409, ex.status());
            assertEquals(response, ex.responseBody());
            assertTrue(ex.getMessage().contains("HTTP 409"));
        }
    }

    @Test public void testInvalidChangesetId() throws IOException
    {
        response = "<html>maintenance</html>";
        try(HttpOsmApi api = api())
        {
            api.createChangeset(Collections.emptyMap());
            fail("Expected ApiException");
        }
        catch(ApiException ex)
        {
            assertTrue(ex.getMessage().startsWith("Server returned an invalid changeset ID"));
        }
    }

    @Test public void testServerUnreachable() throws IOException
    {
        server.stop(0);
        try(HttpOsmApi api = api())
        {
            api.closeChangeset(1);
            fail("Expected ApiException");
        }
        catch(ApiException ex)
        {
            assertEquals(0, ex.status());
        }
    }
}

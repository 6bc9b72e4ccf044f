package com.naag.docsync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.naag.docsync.http.Http;
import com.naag.docsync.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OneDrive / SharePoint drive access through Microsoft Graph.
 */
public final class GraphDriveClient implements RemoteSourceClient {
    private static final Logger log = LoggerFactory.getLogger(GraphDriveClient.class);

    private static final String SELECT = "id,name,lastModifiedDateTime,size,webUrl,file";

    private final String graphBaseUrl;
    private final String driveId;
    private final int pageSize;
    private final Duration timeout;
    private final AccessTokenProvider tokenProvider;

    public GraphDriveClient(String graphBaseUrl, String driveId, int pageSize, Duration timeout,
                            AccessTokenProvider tokenProvider) {
        this.graphBaseUrl = graphBaseUrl;
        this.driveId = driveId;
        this.pageSize = pageSize;
        this.timeout = timeout;
        this.tokenProvider = tokenProvider;
    }

    @Override
    public FolderPage listFolder(String folderPath, String pageToken) {
        String url = pageToken != null ? pageToken : firstPageUrl(folderPath);
        long start = System.currentTimeMillis();

        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Authorization", "Bearer " + tokenProvider.getAccessToken())
                .header("Accept", "application/json")
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString(), "list " + folderPath);

        if (resp.statusCode() / 100 != 2) {
            throw new RemoteSourceException("Graph list HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
        }

        try {
            JsonNode root = Json.MAPPER.readTree(resp.body());
            List<RemoteFile> files = new ArrayList<>();
            for (JsonNode item : root.path("value")) {
                // folders carry a "folder" facet instead of "file"
                if (!item.has("file")) continue;
                files.add(new RemoteFile(
                        item.path("id").asText(),
                        item.path("name").asText(),
                        item.path("lastModifiedDateTime").asText(null),
                        item.path("size").asLong(0),
                        item.path("webUrl").asText(null),
                        "/drives/" + driveId + "/items/" + item.path("id").asText() + "/content"
                ));
            }
            String next = root.path("@odata.nextLink").asText(null);
            log.debug("[GRAPH TIMING] list folder={} files={} hasNext={} took={}ms",
                    folderPath, files.size(), next != null, System.currentTimeMillis() - start);
            return new FolderPage(files, next);
        } catch (Exception e) {
            throw new RemoteSourceException("Bad Graph listing JSON for " + folderPath, e);
        }
    }

    @Override
    public byte[] getContent(String fileId) {
        HttpResponse<byte[]> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(graphBaseUrl + "/drives/" + driveId + "/items/" + encodeSegment(fileId) + "/content"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + tokenProvider.getAccessToken())
                .GET()
                .build(), HttpResponse.BodyHandlers.ofByteArray(), "download " + fileId);

        if (resp.statusCode() / 100 != 2) {
            throw new RemoteSourceException("Graph download HTTP " + resp.statusCode() + " for item " + fileId, resp.statusCode());
        }
        return resp.body();
    }

    String firstPageUrl(String folderPath) {
        return graphBaseUrl + "/drives/" + driveId + "/root:/" + encodePath(folderPath) + ":/children"
                + "?$select=" + SELECT + "&$top=" + pageSize;
    }

    private <T> HttpResponse<T> send(HttpRequest req, HttpResponse.BodyHandler<T> handler, String what) {
        try {
            return Http.CLIENT.send(req, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteSourceException("Graph " + what + " interrupted", e);
        } catch (Exception e) {
            throw new RemoteSourceException("Graph " + what + " failed: " + e.getMessage(), e);
        }
    }

    static String encodePath(String folderPath) {
        String trimmed = folderPath == null ? "" : folderPath.replaceAll("^/+|/+$", "");
        return Arrays.stream(trimmed.split("/"))
                .map(GraphDriveClient::encodeSegment)
                .collect(Collectors.joining("/"));
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

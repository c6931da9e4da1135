package com.mimecast.warden.http;

import com.mimecast.warden.exception.ContentFetchException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OkHttp backed fetcher.
 * <p>
 * Redirects are followed and the final URL reported.
 * <br>Intermediaries are asked not to transform content and a mobile user agent is sent
 * <br>so sites serve their lighter pages.
 */
public class OkHttpFetcher implements HttpFetcher {
    private static final Logger log = LogManager.getLogger(OkHttpFetcher.class);

    private final OkHttpClient httpClient;
    private final String userAgent;

    /**
     * Constructs a new OkHttpFetcher instance.
     *
     * @param userAgent User-Agent header value.
     */
    public OkHttpFetcher(String userAgent) {
        this(new OkHttpClient.Builder()
                .followRedirects(true)
                .followSslRedirects(true)
                .build(), userAgent);
    }

    /**
     * Constructs a new OkHttpFetcher instance with a given client.
     *
     * @param httpClient OkHttpClient instance.
     * @param userAgent  User-Agent header value.
     */
    public OkHttpFetcher(OkHttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    @Override
    public FetchedContent fetch(String url, Duration timeout, long maxSize) throws ContentFetchException {
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("Cache-Control", "no-transform")
                    .header("User-Agent", userAgent)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ContentFetchException("Invalid URL " + url, e);
        }

        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeout)
                .build();

        log.info("Fetching {}", url);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ContentFetchException("HTTP " + response.code() + " for " + url);
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new ContentFetchException("Empty response for " + url);
            }
            if (body.contentLength() > maxSize) {
                throw new ContentFetchException("Content length " + body.contentLength() + " exceeds " + maxSize + " for " + url);
            }

            byte[] bytes;
            int limit = (int) Math.min(maxSize, Integer.MAX_VALUE - 16L);
            try (InputStream in = body.byteStream()) {
                bytes = in.readNBytes(limit + 1);
            }
            if (bytes.length > limit) {
                throw new ContentFetchException("Content exceeds " + maxSize + " bytes for " + url);
            }

            Map<String, String> headers = new LinkedHashMap<>();
            for (String name : response.headers().names()) {
                headers.put(name, response.header(name));
            }

            String finalUrl = response.request().url().toString();
            log.debug("Fetched {} bytes from {}", bytes.length, finalUrl);
            return new FetchedContent(bytes, finalUrl, headers);
        } catch (ContentFetchException e) {
            throw e;
        } catch (IOException e) {
            throw new ContentFetchException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }
}

package com.mimecast.warden.transform;

import com.mimecast.warden.exception.ContentFetchException;
import com.mimecast.warden.http.FetchedContent;
import com.mimecast.warden.http.HttpFetcher;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Duration;

/**
 * Replaces page images with base64 data URIs so the page reads offline.
 * <p>
 * Images declared smaller than 100x100 pixels are dropped as spacers and trackers.
 * <br>Images that fail to download, and any past the configured count, are dropped too.
 */
public class ImageInliner {
    private static final Logger log = LogManager.getLogger(ImageInliner.class);

    private static final int MIN_AREA = 100 * 100;

    private final HttpFetcher httpFetcher;
    private final Duration timeout;
    private final int maxImages;
    private final long maxImageSize;

    /**
     * Constructs a new ImageInliner instance.
     *
     * @param httpFetcher  HTTP fetch collaborator.
     * @param timeout      Per image fetch timeout.
     * @param maxImages    Most images inlined per page.
     * @param maxImageSize Largest image accepted, in bytes.
     */
    public ImageInliner(HttpFetcher httpFetcher, Duration timeout, int maxImages, long maxImageSize) {
        this.httpFetcher = httpFetcher;
        this.timeout = timeout;
        this.maxImages = maxImages;
        this.maxImageSize = maxImageSize;
    }

    /**
     * Inlines the images of a document in place.
     *
     * @param document Jsoup document.
     * @return Number of images inlined.
     */
    public int inline(Document document) {
        int inlined = 0;
        for (Element img : document.select("img")) {
            if (inlined >= maxImages) {
                img.remove();
                continue;
            }

            String src = img.hasAttr("src") ? StringUtils.defaultIfEmpty(img.absUrl("src"), img.attr("src")) : "";
            int area = dimension(img.attr("width")) * dimension(img.attr("height"));
            if (src.isEmpty() || (area >= 1 && area < MIN_AREA)) {
                img.remove();
                continue;
            }

            String data = dataUri(src);
            if (data == null) {
                img.remove();
                continue;
            }

            img.attr("src", data);
            img.attr("width", "100%");
            img.attr("height", "auto");
            inlined++;
        }
        log.debug("Inlined {} image(s) into {}", inlined, document.location());
        return inlined;
    }

    /**
     * Downloads an image as a data URI.
     *
     * @param src Image URL.
     * @return Data URI or null on failure.
     */
    String dataUri(String src) {
        if (src.startsWith("data:")) {
            return src;
        }
        try {
            FetchedContent image = httpFetcher.fetch(src, timeout, maxImageSize);
            return "data:" + image.getMimeType() + ";base64," + Base64.encodeBase64String(image.getBody());
        } catch (ContentFetchException e) {
            log.debug("Dropping image {}: {}", src, e.getMessage());
            return null;
        }
    }

    /**
     * Reads a declared image dimension.
     * <p>Missing attributes count as zero; relative or unparsable sizes count as 100 pixels.
     *
     * @param value Attribute value.
     * @return Pixels.
     */
    static int dimension(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        if (value.contains("%") || value.contains("auto")) {
            return 100;
        }
        String digits = value;
        if (digits.contains("px")) {
            digits = digits.substring(0, digits.indexOf("px"));
        }
        if (digits.contains(".")) {
            digits = digits.substring(0, digits.indexOf('.'));
        }
        return NumberUtils.toInt(digits.trim(), 100);
    }
}

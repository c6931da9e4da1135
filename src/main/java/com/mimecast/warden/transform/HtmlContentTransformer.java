package com.mimecast.warden.transform;

import com.mimecast.warden.exception.ContentFetchException;
import com.mimecast.warden.http.FetchedContent;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.safety.Safelist;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Jsoup based transformer for HTML pages.
 * <p>
 * Non HTML content passes through unchanged.
 * <br>HTML may be sanitized, after the site transform matching the final URL host, and may then
 * <br>be converted to text. The subject prefix records what was done: {@code B} bleached,
 * <br>{@code I} images inlined, {@code TL}/{@code TP} text with or without links.
 */
public class HtmlContentTransformer implements ContentTransformer {
    private static final Logger log = LogManager.getLogger(HtmlContentTransformer.class);

    private final Map<String, SiteTransform> siteTransforms;
    private final ImageInliner imageInliner;

    /**
     * Constructs a new HtmlContentTransformer instance.
     *
     * @param siteTransforms Domain suffix to site transform mapping.
     * @param imageInliner   Image inliner used when images are requested.
     */
    public HtmlContentTransformer(Map<String, SiteTransform> siteTransforms, ImageInliner imageInliner) {
        this.siteTransforms = siteTransforms;
        this.imageInliner = imageInliner;
    }

    @Override
    public TransformedContent transform(FetchedContent content, TransformOptions options) throws ContentFetchException {
        String mimeType = content.getMimeType();
        if (!"text/html".equals(mimeType) && !"application/xhtml+xml".equals(mimeType)) {
            if (mimeType.startsWith("text/")) {
                String text = decode(content.getBody(), content.getCharset())
                        .replace("\r\n", "\n")
                        .replace("\r", "\n");
                return new TransformedContent(text.getBytes(StandardCharsets.UTF_8), mimeType, null, "");
            }
            return new TransformedContent(content.getBody(), mimeType, null, "");
        }

        Document document;
        try {
            document = Jsoup.parse(new ByteArrayInputStream(content.getBody()), content.getCharset(), content.getFinalUrl());
        } catch (IOException e) {
            throw new ContentFetchException("Unable to parse " + content.getFinalUrl(), e);
        }

        String prefix = "";
        if (options.isBleach()) {
            prefix = "B" + prefix;
            document = bleach(document, content.getFinalUrl());
        }
        if (options.isImages()) {
            prefix = "I" + prefix;
            imageInliner.inline(document);
        }

        String title = StringUtils.trimToNull(document.title());

        if (options.isText()) {
            prefix = (options.isWithoutLinks() ? "TP" : "TL") + prefix;
            String text = toText(document, !options.isWithoutLinks());
            return new TransformedContent(text.getBytes(StandardCharsets.UTF_8), "text/plain", title, prefix);
        }

        document.charset(StandardCharsets.UTF_8);
        return new TransformedContent(document.outerHtml().getBytes(StandardCharsets.UTF_8), "text/html", title, prefix);
    }

    /**
     * Applies the matching site transform then keeps only safe markup.
     *
     * @param document Parsed page.
     * @param baseUri  Page URL.
     * @return New sanitized document.
     */
    Document bleach(Document document, String baseUri) {
        SiteTransform site = SiteTransform.forHost(host(baseUri), siteTransforms);
        if (site != SiteTransform.NONE) {
            log.debug("Applying {} to {}", site, baseUri);
        }
        site.apply(document);

        String title = document.title();
        String body = Jsoup.clean(document.body() != null ? document.body().html() : "", baseUri, Safelist.relaxed());

        Document clean = Document.createShell(baseUri);
        if (StringUtils.isNotBlank(title)) {
            clean.title(title);
        }
        clean.body().html(body);
        return clean;
    }

    /**
     * Renders a document as readable plain text.
     *
     * @param document  Jsoup document.
     * @param withLinks Append link targets after anchor text.
     * @return Text.
     */
    public static String toText(Document document, boolean withLinks) {
        Element root = document.body() != null ? document.body() : document;
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    sb.append(((TextNode) node).text());
                } else if (node instanceof Element) {
                    Element element = (Element) node;
                    if (element.normalName().equals("br")) {
                        sb.append('\n');
                    } else if (element.isBlock() && sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
                        sb.append('\n');
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element) {
                    Element element = (Element) node;
                    if (withLinks && element.normalName().equals("a") && element.hasAttr("href")) {
                        sb.append(" <").append(element.absUrl("href").isEmpty() ? element.attr("href") : element.absUrl("href")).append('>');
                    } else if (element.isBlock()) {
                        sb.append('\n');
                    }
                }
            }
        }, root);

        return sb.toString()
                .replaceAll("[ \\t\\x0B\\f\\r]+\\n", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .trim() + "\n";
    }

    /**
     * Decodes text with the declared charset, UTF-8 when missing or unknown.
     *
     * @param bytes   Text bytes.
     * @param charset Declared charset, may be null.
     * @return String.
     */
    static String decode(byte[] bytes, String charset) {
        if (charset != null) {
            try {
                return new String(bytes, Charset.forName(charset));
            } catch (IllegalArgumentException e) {
                log.debug("Unknown charset {}, using UTF-8", charset);
            }
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Gets the host of a URL.
     *
     * @param url URL string.
     * @return Host or null.
     */
    static String host(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url).getHost();
        } catch (URISyntaxException e) {
            log.debug("Unparsable URL {}: {}", url, e.getMessage());
            return null;
        }
    }
}

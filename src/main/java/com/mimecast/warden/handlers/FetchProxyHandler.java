package com.mimecast.warden.handlers;

import com.mimecast.warden.config.ProxyConfig;
import com.mimecast.warden.exception.ContentFetchException;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.http.FetchedContent;
import com.mimecast.warden.http.HttpFetcher;
import com.mimecast.warden.mailbox.MailboxResponse;
import com.mimecast.warden.mailbox.MailboxSession;
import com.mimecast.warden.mime.MessageBuilder;
import com.mimecast.warden.mime.ParsedMessage;
import com.mimecast.warden.smtp.Credentials;
import com.mimecast.warden.smtp.MailSender;
import com.mimecast.warden.transform.ContentTransformer;
import com.mimecast.warden.transform.TransformedContent;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;
import java.util.Set;

/**
 * Fetches the pages linked from a message and files them as mail.
 * <p>
 * Every URL found in the text parts or subject is downloaded, transformed as the request address
 * <br>asks, wrapped in a message, appended to the storage folder and, for Kindle requests, sent on.
 * <br>A failure on one URL is logged and the next URL is tried.
 */
public class FetchProxyHandler extends AbstractContentHandler {
    private static final Logger log = LogManager.getLogger(FetchProxyHandler.class);

    private final ProxyConfig config;
    private final HttpFetcher httpFetcher;
    private final ContentTransformer transformer;

    /**
     * Constructs a new FetchProxyHandler instance.
     *
     * @param config      Proxy settings.
     * @param httpFetcher HTTP fetch collaborator.
     * @param transformer Content transform collaborator.
     * @param mailSender  Outgoing delivery.
     */
    public FetchProxyHandler(ProxyConfig config, HttpFetcher httpFetcher, ContentTransformer transformer, MailSender mailSender) {
        super(mailSender);
        this.config = config;
        this.httpFetcher = httpFetcher;
        this.transformer = transformer;
    }

    @Override
    public ContentHandlerKind getKind() {
        return ContentHandlerKind.FETCH_PROXY;
    }

    @Override
    protected void process(MailboxSession session, ParsedMessage message, Credentials credentials) throws TransportException {
        String sender = SenderResolver.resolveOriginator(message);
        log.info("Proxy URLs for: {}", sender);

        ProxyOptions options = ProxyOptions.parse(message.getTo(), config, sender);
        Set<String> urls = UrlExtractor.extract(message);
        for (String url : urls) {
            fetchAndStore(session, url, message, options, credentials);
        }
    }

    /**
     * Fetches one URL, stores the result and optionally sends it.
     *
     * @throws TransportException Connection failure while appending.
     */
    void fetchAndStore(MailboxSession session, String url, ParsedMessage message, ProxyOptions options, Credentials credentials) throws TransportException {
        try {
            MimeMessage proxied = buildMessage(url, StringUtils.defaultString(message.getSubject()), message.getMessageId(), options);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            proxied.writeTo(out);
            MailboxResponse<Void> appended = session.append(config.getStoreTo(), "", new Date(), out.toByteArray());
            log.info("APPEND to {}: {} {}", config.getStoreTo(), appended.getStatus(), StringUtils.defaultString(appended.getText()));

            if (options.isSendUsingSmtp()) {
                send(credentials, options.getSendFrom(), options.getSendTo(), proxied);
            }
        } catch (TransportException e) {
            throw e;
        } catch (ContentFetchException e) {
            log.warn("Failed to fetch {}: {}", url, e.getMessage());
        } catch (MessagingException | IOException | RuntimeException e) {
            log.error("Error processing {}: {}", url, e.getMessage(), e);
        }
    }

    /**
     * Builds the message carrying the content of one URL.
     *
     * @param url       URL.
     * @param subject   Subject of the request.
     * @param messageId Message-ID of the request.
     * @param options   Proxy options.
     * @return MimeMessage instance.
     * @throws ContentFetchException Fetch or transform failure.
     * @throws MessagingException    Message construction failure.
     */
    MimeMessage buildMessage(String url, String subject, String messageId, ProxyOptions options) throws ContentFetchException, MessagingException {
        log.info("Fetch URL: {}", url);
        FetchedContent fetched = httpFetcher.fetch(url, config.getFetchTimeout(), config.getMaxDownloadSize());
        TransformedContent content = transformer.transform(fetched, options.toTransformOptions());

        String mimeType = content.getMimeType();
        String subtype = StringUtils.substringAfter(mimeType, "/");
        String filename = filename(fetched);
        String title = content.getTitle() != null ? content.getTitle() : subject;
        String finalSubject = content.getPrefix().isEmpty() ? title : "[" + content.getPrefix() + "]: " + title;
        String info = info(fetched);

        MessageBuilder builder = new MessageBuilder()
                .subject(finalSubject)
                .from(options.getSendFrom())
                .to(options.getSendTo())
                .inReplyTo(messageId)
                .messageIdDomain("proxy");

        if (content.isText()) {
            filename = fixExtension(filename, subtype);
            if (options.isInline()) {
                builder.body(info + "\n\n" + new String(content.getBody(), StandardCharsets.UTF_8));
            } else {
                builder.body(info)
                        .attachment(content.getBody(), mimeType + "; charset=utf-8", subject + ": " + filename);
            }
        } else {
            String fullFilename = subject + ": " + filename;
            if (mimeType.startsWith("application/") && subtype.contains("pdf") && !filename.endsWith(".pdf")) {
                fullFilename = fullFilename + ".pdf";
            }
            builder.body(info)
                    .attachment(content.getBody(), mimeType, fullFilename);
        }

        return builder.build();
    }

    /**
     * Gets the file name from Content-Disposition, or derives one from the URL.
     *
     * @param fetched Fetched content.
     * @return File name.
     */
    static String filename(FetchedContent fetched) {
        String disposition = fetched.getHeader("Content-Disposition");
        if (disposition != null && disposition.contains("filename=")) {
            String name = StringUtils.substringBefore(StringUtils.substringAfter(disposition, "filename="), ";");
            name = StringUtils.strip(name.trim(), "\"'");
            if (!name.isEmpty()) {
                return name;
            }
        }

        String name = StringUtils.defaultString(fetched.getFinalUrl())
                .replace("http://", "")
                .replace("https://", "")
                .replace('/', ' ')
                .replace('.', ' ')
                .trim();
        return name.isEmpty() ? "download" : name;
    }

    /**
     * Ensures the file name carries the extension of a text subtype.
     *
     * @param filename File name.
     * @param subtype  MIME subtype.
     * @return File name.
     */
    static String fixExtension(String filename, String subtype) {
        if ("plain".equals(subtype) && !filename.endsWith(".txt")) {
            return filename + ".txt";
        }
        if ("html".equals(subtype) && !filename.endsWith(".html")) {
            return filename + ".html";
        }
        return filename;
    }

    /**
     * Renders the response headers as the message body preamble.
     */
    private static String info(FetchedContent fetched) {
        StringBuilder sb = new StringBuilder();
        sb.append("URL: ").append(fetched.getFinalUrl()).append('\n');
        for (Map.Entry<String, String> header : fetched.getHeaders().entrySet()) {
            sb.append(header.getKey()).append(": ").append(header.getValue()).append('\n');
        }
        return sb.toString().trim();
    }
}

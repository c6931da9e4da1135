package com.mimecast.warden.handlers;

import com.mimecast.warden.config.WardenConfig;
import com.mimecast.warden.http.HttpFetcher;
import com.mimecast.warden.smtp.MailSender;
import com.mimecast.warden.transform.ContentTransformer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds and holds the content handlers for one configuration.
 * <p>Handlers are registered by kind and looked up by their configuration name.
 */
public class HandlerFactory {
    private static final Logger log = LogManager.getLogger(HandlerFactory.class);

    private final Map<ContentHandlerKind, ContentHandler> handlers = new EnumMap<>(ContentHandlerKind.class);

    /**
     * Constructs a new HandlerFactory and registers all handlers.
     *
     * @param config      Configuration.
     * @param mailSender  Outgoing delivery.
     * @param httpFetcher HTTP fetch collaborator.
     * @param transformer Content transform collaborator.
     */
    public HandlerFactory(WardenConfig config, MailSender mailSender, HttpFetcher httpFetcher, ContentTransformer transformer) {
        String language = config.getDefaultLanguage();
        register(new AutoForwardReplyHandler(config.getAutoForwardReply(), language, mailSender));
        register(new RejectAndDeleteHandler(config.getRejectAndDelete(), language, mailSender));
        register(new FetchProxyHandler(config.getFetchProxy(), httpFetcher, transformer, mailSender));
    }

    /**
     * Registers a handler, replacing any handler of the same kind.
     *
     * @param handler Content handler.
     */
    public void register(ContentHandler handler) {
        handlers.put(handler.getKind(), handler);
        log.debug("Registered handler: {}", handler.getKind().getConfigName());
    }

    /**
     * Gets a handler by configuration name.
     *
     * @param name Handler name (case-insensitive).
     * @return Optional containing the handler if found.
     */
    public Optional<ContentHandler> getHandler(String name) {
        return ContentHandlerKind.fromConfigName(name).map(handlers::get);
    }

    public ContentHandler getHandler(ContentHandlerKind kind) {
        return handlers.get(kind);
    }

    public Map<ContentHandlerKind, ContentHandler> getHandlers() {
        return Collections.unmodifiableMap(handlers);
    }
}

package com.sitewatch.sites.rss;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitewatch.core.util.HashingUtils;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.sites.api.DiffingSite;
import com.sitewatch.sites.api.SiteContext;
import com.sitewatch.sites.config.RssSiteConfig;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Watches one RSS 2.0 or Atom feed and announces entries it has not seen on the previous check.
 */
public class RssFeedSite extends DiffingSite<List<FeedItem>> {
    private static final Comparator<FeedItem> OLDEST_FIRST =
            Comparator.comparing(FeedItem::publishedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    private final RssSiteConfig config;

    public RssFeedSite(RssSiteConfig config) {
        this.config = config;
    }

    @Override
    public String id() {
        return config.id();
    }

    @Override
    public String displayName() {
        return config.displayName();
    }

    @Override
    public String description() {
        return config.description();
    }

    @Override
    public String schedule() {
        return config.schedule();
    }

    @Override
    protected CompletableFuture<List<FeedItem>> fetch(SiteContext ctx) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.url()))
                .GET()
                .timeout(ctx.requestTimeout())
                .build();

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(response -> {
                    if (response.statusCode() >= 400) {
                        throw new IllegalStateException("HTTP status " + response.statusCode() + " from " + config.url());
                    }
                    return parseItems(response.body());
                });
    }

    @Override
    protected List<String> firstRunMessages(List<FeedItem> latest) {
        return format(newest(latest));
    }

    @Override
    protected List<String> newMessages(List<FeedItem> previous, List<FeedItem> latest) {
        Set<String> seen = new HashSet<>();
        for (FeedItem item : previous) {
            seen.add(item.key());
        }
        List<FeedItem> unseen = latest.stream()
                .filter(item -> !seen.contains(item.key()))
                .toList();
        return format(newest(unseen));
    }

    @Override
    protected JsonNode toCache(List<FeedItem> snapshot) {
        ObjectNode root = JsonUtils.objectMapper().createObjectNode();
        root.put("url", config.url());
        ArrayNode items = root.putArray("items");
        for (FeedItem item : snapshot) {
            ObjectNode node = items.addObject();
            node.put("key", item.key());
            node.put("title", item.title());
            node.put("link", item.link());
            node.put("publishedAt", item.publishedAt().toString());
        }
        return root;
    }

    @Override
    protected List<FeedItem> fromCache(JsonNode cached) {
        List<FeedItem> items = new ArrayList<>();
        for (JsonNode node : cached.path("items")) {
            items.add(new FeedItem(
                    node.path("key").asText(),
                    node.path("title").asText(),
                    node.path("link").asText(),
                    parseDate(node.path("publishedAt").asText(null))
            ));
        }
        return items;
    }

    private List<FeedItem> newest(List<FeedItem> items) {
        List<FeedItem> sorted = new ArrayList<>(items);
        sorted.sort(OLDEST_FIRST);
        int from = Math.max(0, sorted.size() - config.maxMessagesPerCheck());
        return sorted.subList(from, sorted.size());
    }

    private List<String> format(List<FeedItem> items) {
        return items.stream()
                .map(item -> item.link().isBlank()
                        ? "[" + config.displayName() + "]\n" + item.title()
                        : "[" + config.displayName() + "]\n" + item.title() + "\n" + item.link())
                .toList();
    }

    /** Parses raw feed bytes; the parser picks the encoding from the BOM or XML declaration. */
    static List<FeedItem> parseItems(byte[] xml) {
        Document document;
        try {
            document = newDocumentBuilder().parse(new ByteArrayInputStream(xml));
        } catch (Exception e) {
            throw new IllegalStateException("Invalid RSS/Atom XML from feed", e);
        }
        Element root = document.getDocumentElement();
        String rootName = root == null ? "" : root.getTagName().toLowerCase(Locale.ROOT);
        if ("rss".equals(rootName)) {
            return parseRss(document);
        }
        if ("feed".equals(rootName)) {
            return parseAtom(document);
        }
        throw new IllegalStateException("Not an RSS or Atom document: <" + rootName + ">");
    }

    private static DocumentBuilder newDocumentBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
            }

            @Override
            public void error(SAXParseException exception) throws SAXParseException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXParseException {
                throw exception;
            }
        });
        return builder;
    }

    private static List<FeedItem> parseRss(Document document) {
        NodeList nodes = document.getElementsByTagName("item");
        List<FeedItem> items = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node item = nodes.item(i);
            String title = childText(item, "title").orElse("(untitled)");
            String link = childText(item, "link").orElse("");
            String guid = childText(item, "guid").orElse(link);
            Instant publishedAt = parseDate(childText(item, "pubDate").orElse(null));
            items.add(new FeedItem(keyOf(guid, title), title, link, publishedAt));
        }
        return items;
    }

    private static List<FeedItem> parseAtom(Document document) {
        NodeList entries = document.getElementsByTagName("entry");
        List<FeedItem> items = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Node entry = entries.item(i);
            String title = childText(entry, "title").orElse("(untitled)");
            String link = childAttribute(entry, "link", "href").orElse("");
            String id = childText(entry, "id").orElse(link);
            Instant publishedAt = parseDate(childText(entry, "updated").orElseGet(() -> childText(entry, "published").orElse(null)));
            items.add(new FeedItem(keyOf(id, title), title, link, publishedAt));
        }
        return items;
    }

    private static String keyOf(String identity, String title) {
        return identity == null || identity.isBlank() ? "title:" + HashingUtils.sha256(title) : identity;
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        return text == null ? Optional.empty() : Optional.of(text.trim());
    }

    private static Optional<String> childAttribute(Node parent, String tagName, String attribute) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0 || !(children.item(0) instanceof Element child)) {
            return Optional.empty();
        }
        String value = child.getAttribute(attribute);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Instant.EPOCH;
        }
        List<Function<String, Instant>> parsers = List.of(
                Instant::parse,
                v -> OffsetDateTime.parse(v).toInstant(),
                v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()
        );
        for (Function<String, Instant> parser : parsers) {
            try {
                return parser.apply(value.trim());
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Instant.EPOCH;
    }
}

package com.citygml.resolver.codelist;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import com.citygml.resolver.core.context.ResolverConfig;

/**
 * Parser for CityGML codelist documents.
 *
 * Format (GML namespace):
 * <pre>
 * &lt;gml:Dictionary&gt;
 *   &lt;gml:dictionaryEntry&gt;
 *     &lt;gml:Definition&gt;
 *       &lt;gml:description&gt;住宅&lt;/gml:description&gt;
 *       &lt;gml:name&gt;401&lt;/gml:name&gt;
 *     &lt;/gml:Definition&gt;
 *   &lt;/gml:dictionaryEntry&gt;
 * &lt;/gml:Dictionary&gt;
 * </pre>
 * Definitions lacking a name or a description are skipped.
 */
public class CodeDictionaryParser {
    private static final Logger log = LoggerFactory.getLogger(CodeDictionaryParser.class);

    public static final String GML_NAMESPACE = "http://www.opengis.net/gml";

    private final Duration fetchTimeout;

    public CodeDictionaryParser() {
        this(ResolverConfig.DEFAULT_FETCH_TIMEOUT);
    }

    public CodeDictionaryParser(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public CodeDictionary parse(Path path) {
        return parse(path.toString());
    }

    public CodeDictionary parse(String source) {
        byte[] content = read(source);
        Map<String, String> entries = parseEntries(source, content);
        log.debug("Loaded {} codes from {}", entries.size(), source);
        return new CodeDictionary(source, entries);
    }

    private byte[] read(String source) {
        try {
            if (isRemote(source)) {
                return fetch(source);
            }
            return Files.readAllBytes(Path.of(source));
        } catch (IOException e) {
            throw new DictionaryLoadException(source, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DictionaryLoadException(source, "interrupted while fetching", e);
        }
    }

    private byte[] fetch(String url) throws IOException, InterruptedException {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(fetchTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(fetchTimeout)
                .GET()
                .build();

        log.info("Fetching codelist: {}", url);
        HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + response.statusCode());
        }
        return response.body();
    }

    private Map<String, String> parseEntries(String source, byte[] content) {
        Document document;
        try {
            document = newDocumentBuilder().parse(new ByteArrayInputStream(content));
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new DictionaryLoadException(source, e.getMessage(), e);
        }

        Map<String, String> entries = new LinkedHashMap<>();
        Element root = document.getDocumentElement();
        for (Element entry : gmlChildren(root, "dictionaryEntry")) {
            for (Element definition : gmlChildren(entry, "Definition")) {
                String name = firstGmlChildText(definition, "name");
                String description = firstGmlChildText(definition, "description");
                if (isEmpty(name) || isEmpty(description)) {
                    continue;
                }
                entries.put(name, description);
            }
        }
        return entries;
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }

    private static List<Element> gmlChildren(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element
                    && GML_NAMESPACE.equals(element.getNamespaceURI())
                    && localName.equals(element.getLocalName())) {
                result.add(element);
            }
        }
        return result;
    }

    private static String firstGmlChildText(Element parent, String localName) {
        List<Element> matches = gmlChildren(parent, localName);
        return matches.isEmpty() ? null : matches.get(0).getTextContent();
    }

    private static boolean isRemote(String source) {
        String lower = source.toLowerCase(Locale.ROOT);
        return lower.startsWith("https://") || lower.startsWith("http://");
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}

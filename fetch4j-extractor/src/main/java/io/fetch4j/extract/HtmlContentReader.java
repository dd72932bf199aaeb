package io.fetch4j.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Title, main text and metadata heuristics applied to a parsed page, whichever strategy produced it.
 */
public class HtmlContentReader {

    private final ExtractorProperties props;

    public HtmlContentReader(ExtractorProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    public String title(Document doc) {
        return doc.title().trim();
    }

    /**
     * Text of the first element matching the selector priority list, else the text of the whole document.
     * Scripts and styles are removed from {@code doc}.
     */
    public String body(Document doc) {
        doc.select("script, style").remove();

        for (String selector : props.getContentSelectors()) {
            Element element = doc.selectFirst(selector);
            if (element != null) {
                return element.text().trim();
            }
        }
        return doc.text().trim();
    }

    /**
     * {@code <meta>} name/property pairs, then the first {@code links} and {@code images}.
     */
    public Map<String, Object> metadata(Document doc) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        for (Element meta : doc.select("meta")) {
            String name = meta.hasAttr("name") ? meta.attr("name") : meta.attr("property");
            String content = meta.attr("content");
            if (!name.isEmpty() && !content.isEmpty()) {
                metadata.put(name, content);
            }
        }

        metadata.put("links", firstAttributes(doc, "a[href]", "href", props.getMaxLinks()));
        metadata.put("images", firstAttributes(doc, "img[src]", "src", props.getMaxImages()));
        return metadata;
    }

    /**
     * Rejects anything that is not an absolute http(s) URL.
     *
     * @throws IllegalArgumentException if the target cannot be fetched at all
     */
    public static URI requireHttpUrl(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Unsupported target: " + target);
        }
        URI uri;
        try {
            uri = new URI(target.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Unsupported target: " + target, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("Unsupported target: " + target);
        }
        return uri;
    }

    private static List<String> firstAttributes(Document doc, String query, String attribute, int limit) {
        List<String> values = new ArrayList<>();
        for (Element element : doc.select(query)) {
            if (values.size() >= limit) {
                break;
            }
            String value = element.attr(attribute);
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}

package io.fetch4j.extract;

import io.fetch4j.Extractor;
import io.fetch4j.core.ExtractionResult;
import io.fetch4j.core.FetchException;
import io.fetch4j.core.FetchStrategy;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Plain HTTP GET, parsed with jsoup. No script execution.
 */
public class StaticExtractor implements Extractor {
    private static final Logger log = LoggerFactory.getLogger(StaticExtractor.class);

    private final ExtractorProperties props;
    private final HtmlContentReader reader;

    public StaticExtractor(ExtractorProperties props) {
        this(props, new HtmlContentReader(props));
    }

    public StaticExtractor(ExtractorProperties props, HtmlContentReader reader) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    @Override
    public FetchStrategy strategy() {
        return FetchStrategy.STATIC;
    }

    @Override
    public ExtractionResult fetch(String target) throws FetchException {
        HtmlContentReader.requireHttpUrl(target);

        Connection.Response response;
        try {
            response = Jsoup.connect(target)
                    .userAgent(props.getUserAgent())
                    .timeout((int) props.getTimeout().toMillis())
                    .ignoreContentType(true)
                    .followRedirects(true)
                    .execute();
        } catch (HttpStatusException e) {
            throw new FetchException(target, "HTTP " + e.getStatusCode() + " for " + target, e);
        } catch (IOException e) {
            throw new FetchException(target, describe(e), e);
        }

        Document doc;
        try {
            doc = response.parse();
        } catch (IOException e) {
            throw new FetchException(target, "Failed to parse response: " + describe(e), e);
        }

        String title = reader.title(doc);
        String body = reader.body(doc);
        Map<String, Object> metadata = reader.metadata(doc);
        metadata.put("status_code", response.statusCode());
        metadata.put("content_type", response.contentType() == null ? "" : response.contentType());

        log.debug("Static fetch done target={} status={} bodyLength={}", target, response.statusCode(), body.length());
        return ExtractionResult.success(target, title, body, metadata, FetchStrategy.STATIC);
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

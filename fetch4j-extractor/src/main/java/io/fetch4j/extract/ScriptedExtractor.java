package io.fetch4j.extract;

import io.fetch4j.Extractor;
import io.fetch4j.core.ExtractionResult;
import io.fetch4j.core.FetchException;
import io.fetch4j.core.FetchStrategy;
import io.fetch4j.core.StrategyInitException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.openqa.selenium.By;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Loads the target in a real browser so client-side scripts run before extraction.
 *
 * <p>Every fetch opens its own session and quits it afterwards. When no browser can be started the fetch is
 * served by the static strategy instead; the result then reports {@link FetchStrategy#STATIC} and carries
 * {@code degraded_from} / {@code degrade_reason} metadata.
 */
public class ScriptedExtractor implements Extractor {
    private static final Logger log = LoggerFactory.getLogger(ScriptedExtractor.class);

    public static final String DEGRADED_FROM = "degraded_from";
    public static final String DEGRADE_REASON = "degrade_reason";

    private final ExtractorProperties props;
    private final BrowserSessionFactory sessions;
    private final HtmlContentReader reader;
    private final Extractor fallback;

    public ScriptedExtractor(ExtractorProperties props, BrowserSessionFactory sessions, Extractor fallback) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.reader = new HtmlContentReader(props);
    }

    @Override
    public FetchStrategy strategy() {
        return FetchStrategy.SCRIPTED;
    }

    @Override
    public ExtractionResult fetch(String target) throws FetchException {
        HtmlContentReader.requireHttpUrl(target);

        WebDriver driver;
        try {
            driver = sessions.open();
        } catch (StrategyInitException e) {
            log.warn("Browser unavailable, degrading to static fetch target={} msg={}", target, e.getMessage());
            return fallback.fetch(target)
                    .withMetadata(DEGRADED_FROM, "scripted")
                    .withMetadata(DEGRADE_REASON, e.getMessage() == null ? "browser unavailable" : e.getMessage());
        }

        try {
            driver.get(target);
            new WebDriverWait(driver, props.getReadyWait())
                    .until(ExpectedConditions.presenceOfElementLocated(By.tagName("body")));
            settle(target);

            String title = driver.getTitle();
            Document doc = Jsoup.parse(driver.getPageSource(), baseUri(driver, target));
            if (title == null || title.isBlank()) {
                title = reader.title(doc);
            }

            String body = reader.body(doc);
            log.debug("Scripted fetch done target={} bodyLength={}", target, body.length());
            return ExtractionResult.success(target, title.trim(), body, reader.metadata(doc), FetchStrategy.SCRIPTED);
        } catch (TimeoutException e) {
            throw new FetchException(target, "Page not ready within " + props.getReadyWait(), e);
        } catch (WebDriverException e) {
            throw new FetchException(target, "Browser fetch failed: " + e.getMessage(), e);
        } finally {
            quit(driver);
        }
    }

    private void settle(String target) throws FetchException {
        Duration pause = props.getRenderSettle();
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(target, "Interrupted while waiting for the page to render", e);
        }
    }

    private static String baseUri(WebDriver driver, String target) {
        String current = driver.getCurrentUrl();
        return current == null || current.isBlank() ? target : current;
    }

    private static void quit(WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to quit browser session msg={}", e.getMessage());
        }
    }
}

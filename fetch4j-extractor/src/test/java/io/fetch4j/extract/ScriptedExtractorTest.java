package io.fetch4j.extract;

import io.fetch4j.Extractor;
import io.fetch4j.core.ExtractionResult;
import io.fetch4j.core.FetchException;
import io.fetch4j.core.FetchStrategy;
import io.fetch4j.core.StrategyInitException;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScriptedExtractorTest {

    private static final String PAGE = "https://example.test/app";
    private static final String RENDERED = "<html><head><title>Shell</title>"
            + "<meta name=\"description\" content=\"rendered by scripts\"></head>"
            + "<body><article><p>Loaded by JavaScript</p></article><a href=\"/next\">next</a></body></html>";

    @Test
    void fetchShouldReadTheRenderedDom() throws Exception {
        WebDriver driver = renderingDriver();
        ScriptedExtractor extractor = new ScriptedExtractor(props(), () -> driver, staticFallback());

        ExtractionResult result = extractor.fetch(PAGE);

        assertEquals(FetchStrategy.SCRIPTED, result.strategyUsed());
        assertEquals("Rendered Title", result.title());
        assertEquals("Loaded by JavaScript", result.body());
        assertEquals("rendered by scripts", result.metadata().get("description"));
        assertEquals(List.of("/next"), result.metadata().get("links"));
        verify(driver).get(PAGE);
        verify(driver).quit();
    }

    @Test
    void pageThatNeverBecomesReadyShouldFailAndQuit() {
        WebDriver driver = mock(WebDriver.class);
        when(driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("no body"));
        ExtractorProperties props = props();
        props.setReadyWait(Duration.ofMillis(100));
        ScriptedExtractor extractor = new ScriptedExtractor(props, () -> driver, staticFallback());

        FetchException e = assertThrows(FetchException.class, () -> extractor.fetch(PAGE));

        assertEquals(PAGE, e.target());
        verify(driver).quit();
    }

    @Test
    void unavailableBrowserShouldDegradeToStatic() throws Exception {
        AtomicInteger fallbackCalls = new AtomicInteger();
        Extractor fallback = new Extractor() {
            @Override
            public FetchStrategy strategy() {
                return FetchStrategy.STATIC;
            }

            @Override
            public ExtractionResult fetch(String target) {
                fallbackCalls.incrementAndGet();
                return ExtractionResult.success(target, "Static", "static body", Map.of("status_code", 200),
                        FetchStrategy.STATIC);
            }
        };
        BrowserSessionFactory broken = () -> {
            throw new StrategyInitException("chrome binary not found", null);
        };
        ScriptedExtractor extractor = new ScriptedExtractor(props(), broken, fallback);

        ExtractionResult result = extractor.fetch(PAGE);

        assertEquals(1, fallbackCalls.get());
        assertEquals(FetchStrategy.STATIC, result.strategyUsed());
        assertEquals("success", result.status());
        assertEquals("static body", result.body());
        assertEquals("scripted", result.metadata().get(ScriptedExtractor.DEGRADED_FROM));
        assertEquals("chrome binary not found", result.metadata().get(ScriptedExtractor.DEGRADE_REASON));
        assertEquals(200, result.metadata().get("status_code"));
    }

    @Test
    void nonHttpTargetShouldBeRejectedBeforeOpeningBrowser() throws Exception {
        BrowserSessionFactory sessions = mock(BrowserSessionFactory.class);
        ScriptedExtractor extractor = new ScriptedExtractor(props(), sessions, staticFallback());

        assertThrows(IllegalArgumentException.class, () -> extractor.fetch("file:///etc/hosts"));
        verify(sessions, never()).open();
    }

    @Test
    void chromeOptionsShouldCarryBrowserFlags() {
        ExtractorProperties props = props();
        props.setUserAgent("fetch4j-test");
        ChromeBrowserSessionFactory factory = new ChromeBrowserSessionFactory(props);

        String args = String.valueOf(factory.options().asMap().get("goog:chromeOptions"));

        assertTrue(args.contains("--headless=new"));
        assertTrue(args.contains("--no-sandbox"));
        assertTrue(args.contains("--disable-dev-shm-usage"));
        assertTrue(args.contains("--disable-gpu"));
        assertTrue(args.contains("--user-agent=fetch4j-test"));
    }

    private static WebDriver renderingDriver() {
        WebDriver driver = mock(WebDriver.class);
        when(driver.findElement(any(By.class))).thenReturn(mock(WebElement.class));
        when(driver.getTitle()).thenReturn("Rendered Title");
        when(driver.getPageSource()).thenReturn(RENDERED);
        when(driver.getCurrentUrl()).thenReturn(PAGE);
        return driver;
    }

    private static ExtractorProperties props() {
        ExtractorProperties props = new ExtractorProperties();
        props.setRenderSettle(Duration.ZERO);
        props.setReadyWait(Duration.ofSeconds(1));
        return props;
    }

    private static Extractor staticFallback() {
        return new StaticExtractor(new ExtractorProperties());
    }
}

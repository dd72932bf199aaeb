package io.fetch4j.extract;

import io.fetch4j.core.StrategyInitException;
import org.openqa.selenium.WebDriver;

/**
 * Opens a fresh browser session per fetch. The caller quits it.
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    WebDriver open() throws StrategyInitException;
}

package io.fetch4j.extract;

import io.fetch4j.core.StrategyInitException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Local Chrome through Selenium Manager, which resolves a matching driver binary on first use.
 */
public class ChromeBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(ChromeBrowserSessionFactory.class);

    private final ExtractorProperties props;

    public ChromeBrowserSessionFactory(ExtractorProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public WebDriver open() throws StrategyInitException {
        ChromeDriver driver;
        try {
            driver = new ChromeDriver(options());
        } catch (WebDriverException e) {
            log.error("Failed to start Chrome msg={}", e.getMessage());
            throw new StrategyInitException("Failed to start Chrome: " + e.getMessage(), e);
        }

        try {
            driver.manage().timeouts().pageLoadTimeout(props.getTimeout());
            return driver;
        } catch (WebDriverException e) {
            driver.quit();
            throw new StrategyInitException("Failed to configure Chrome: " + e.getMessage(), e);
        }
    }

    ChromeOptions options() {
        ChromeOptions options = new ChromeOptions();
        if (props.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
                "--no-sandbox",
                "--disable-dev-shm-usage",
                "--disable-gpu",
                "--user-agent=" + props.getUserAgent()
        );
        return options;
    }
}

package io.fetch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fetch4j.FetchScheduler;
import io.fetch4j.core.ExtractorRegistry;
import io.fetch4j.core.FetchStrategy;
import io.fetch4j.core.ResultStore;
import io.fetch4j.extract.ExtractorProperties;
import io.fetch4j.internal.mongo.MongoResultStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class FetchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FetchAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "fetch4j.enabled=true",
                    "fetch4j.process-every=500ms"
            );

    @Test
    void shouldAutoConfigureFetchBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(FetchScheduler.class);
            assertThat(context).hasSingleBean(FetchLifecycle.class);
            assertThat(context).hasSingleBean(FetchProperties.class);
            assertThat(context).hasSingleBean(ExtractorProperties.class);
            assertThat(context).hasSingleBean(FetchMongoIndexConfig.class);
            assertThat(context.getBean(ResultStore.class)).isInstanceOf(MongoResultStore.class);

            ExtractorRegistry registry = context.getBean(ExtractorRegistry.class);
            assertThat(registry.supports(FetchStrategy.STATIC)).isTrue();
            assertThat(registry.supports(FetchStrategy.SCRIPTED)).isTrue();
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "fetch4j.max-concurrency=4",
                        "fetch4j.retry-base-delay=10s",
                        "fetch4j.timezone=Asia/Taipei",
                        "fetch4j.extractor.timeout=15s",
                        "fetch4j.extractor.headless=false",
                        "fetch4j.extractor.content-selectors=article,#story"
                )
                .run(context -> {
                    FetchProperties props = context.getBean(FetchProperties.class);
                    assertThat(props.getMaxConcurrency()).isEqualTo(4);
                    assertThat(props.getProcessEvery()).isEqualTo(Duration.ofMillis(500));
                    assertThat(props.getRetryBaseDelay()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(props.getMaxRetries()).isEqualTo(3);
                    assertThat(props.getTimezone()).isEqualTo("Asia/Taipei");

                    ExtractorProperties extractor = context.getBean(ExtractorProperties.class);
                    assertThat(extractor.getTimeout()).isEqualTo(Duration.ofSeconds(15));
                    assertThat(extractor.isHeadless()).isFalse();
                    assertThat(extractor.getContentSelectors()).containsExactly("article", "#story");
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("fetch4j.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(FetchScheduler.class);
                    assertThat(context).doesNotHaveBean(FetchLifecycle.class);
                });
    }

    @Test
    void shouldPreferUserResultStore() {
        ResultStore custom = mock(ResultStore.class);
        contextRunner
                .withBean("customResultStore", ResultStore.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(ResultStore.class);
                    assertThat(context.getBean(ResultStore.class)).isSameAs(custom);
                });
    }
}

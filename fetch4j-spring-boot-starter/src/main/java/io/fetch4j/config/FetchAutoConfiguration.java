package io.fetch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fetch4j.Extractor;
import io.fetch4j.FetchScheduler;
import io.fetch4j.core.ExtractorRegistry;
import io.fetch4j.core.ResultStore;
import io.fetch4j.extract.BrowserSessionFactory;
import io.fetch4j.extract.ChromeBrowserSessionFactory;
import io.fetch4j.extract.ExtractorProperties;
import io.fetch4j.extract.ScriptedExtractor;
import io.fetch4j.extract.StaticExtractor;
import io.fetch4j.internal.DefaultFetchScheduler;
import io.fetch4j.internal.mongo.MongoResultStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for fetch4j components.
 */
@AutoConfiguration
@ConditionalOnClass({FetchScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "fetch4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FetchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "fetch4j")
    public FetchProperties fetchProperties() {
        return new FetchProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "fetch4j.extractor")
    public ExtractorProperties extractorProperties() {
        return new ExtractorProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    protected ResultStore resultStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoResultStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected FetchMongoIndexConfig fetchMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new FetchMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public StaticExtractor staticExtractor(ExtractorProperties extractorProperties) {
        return new StaticExtractor(extractorProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public BrowserSessionFactory browserSessionFactory(ExtractorProperties extractorProperties) {
        return new ChromeBrowserSessionFactory(extractorProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScriptedExtractor scriptedExtractor(ExtractorProperties extractorProperties,
                                               BrowserSessionFactory browserSessionFactory,
                                               StaticExtractor staticExtractor) {
        return new ScriptedExtractor(extractorProperties, browserSessionFactory, staticExtractor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExtractorRegistry extractorRegistry(ObjectProvider<List<Extractor>> extractorsProvider) {
        List<Extractor> extractors = extractorsProvider.getIfAvailable(List::of);
        return new ExtractorRegistry(extractors);
    }

    @Bean
    @ConditionalOnMissingBean
    public FetchScheduler fetchScheduler(FetchProperties props, ResultStore resultStore, ExtractorRegistry registry) {
        return new DefaultFetchScheduler(props, resultStore, registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public FetchLifecycle fetchLifecycle(FetchScheduler fetchScheduler) {
        return new FetchLifecycle(fetchScheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "fetch4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton fetchIndexesInitializer(FetchMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

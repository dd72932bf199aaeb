package io.fetch4j.config;

import io.fetch4j.internal.mongo.FetchJobDocument;
import io.fetch4j.internal.mongo.ResultRecordDocument;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FetchMongoIndexConfigTest {

    @Test
    void ensureIndexesShouldCoverJobListingAndRecentResults() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        IndexOperations jobOps = mock(IndexOperations.class);
        IndexOperations resultOps = mock(IndexOperations.class);
        when(mongoTemplate.indexOps(FetchJobDocument.class)).thenReturn(jobOps);
        when(mongoTemplate.indexOps(ResultRecordDocument.class)).thenReturn(resultOps);

        new FetchMongoIndexConfig(mongoTemplate).ensureIndexes();

        ArgumentCaptor<IndexDefinition> jobIndex = ArgumentCaptor.forClass(IndexDefinition.class);
        ArgumentCaptor<IndexDefinition> resultIndex = ArgumentCaptor.forClass(IndexDefinition.class);
        verify(jobOps, times(1)).ensureIndex(jobIndex.capture());
        verify(resultOps, times(1)).ensureIndex(resultIndex.capture());

        assertThat(jobIndex.getValue().getIndexOptions().getString("name"))
                .isEqualTo(FetchMongoIndexConfig.IDX_STATUS_CREATED_AT);
        assertThat(jobIndex.getValue().getIndexKeys().keySet()).containsExactly("status", "createdAt");
        assertThat(resultIndex.getValue().getIndexOptions().getString("name"))
                .isEqualTo(FetchMongoIndexConfig.IDX_FETCHED_AT);
        assertThat(resultIndex.getValue().getIndexKeys().keySet()).containsExactly("fetchedAt");
    }
}

package com.example.careaccess.config;

import com.example.careaccess.consent.document.ConsentDocument;
import com.example.careaccess.consent.model.ConsentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
@EnableReactiveMongoRepositories(basePackages = "com.example.careaccess.consent.repository")
public class MongoConfig {

    static final String ACTIVE_CONSENT_INDEX = "uniq_active_consent";

    private final ReactiveMongoTemplate mongoTemplate;

    // At most one ACTIVE consent per (patient, grantee, purpose)
    @EventListener(ApplicationReadyEvent.class)
    public void ensureConsentIndexes() {
        Index index = new Index()
                .on("patientId", Sort.Direction.ASC)
                .on("granteeId", Sort.Direction.ASC)
                .on("purpose", Sort.Direction.ASC)
                .unique()
                .named(ACTIVE_CONSENT_INDEX)
                .partial(PartialIndexFilter.of(Criteria.where("status").is(ConsentStatus.ACTIVE.name())));

        mongoTemplate.indexOps(ConsentDocument.class)
                .ensureIndex(index)
                .subscribe(
                        name -> log.info("Ensured consent index {}", name),
                        e -> log.error("Failed to create consent index {}: {}", ACTIVE_CONSENT_INDEX, e.getMessage()));
    }
}

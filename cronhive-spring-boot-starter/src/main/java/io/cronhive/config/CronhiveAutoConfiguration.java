package io.cronhive.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhive.Cronhive;
import io.cronhive.JobHandler;
import io.cronhive.admin.JobAdmin;
import io.cronhive.admin.JobStatsService;
import io.cronhive.core.DefinitionRegistry;
import io.cronhive.internal.DefaultCronhive;
import io.cronhive.internal.mongo.MongoJobStore;
import io.cronhive.store.JobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for cronhive components.
 */
@AutoConfiguration
@ConditionalOnClass({Cronhive.class, MongoTemplate.class})
@ConditionalOnProperty(prefix = "cronhive", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronhiveAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "cronhive")
    public CronhiveProperties cronhiveProperties() {
        return new CronhiveProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock cronhiveClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronhiveMongoIndexConfig cronhiveMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CronhiveMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public DefinitionRegistry definitionRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider,
                                                 ObjectMapper objectMapper, CronhiveProperties props) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new DefinitionRegistry(handlers, objectMapper, props.definitionDefaults());
    }

    @Bean
    @ConditionalOnMissingBean
    public Cronhive cronhive(CronhiveProperties props, JobStore jobStore, DefinitionRegistry registry,
                             ObjectMapper om, Clock clock) {
        return new DefaultCronhive(props, jobStore, registry, om, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAdmin jobAdmin(JobStore jobStore, DefinitionRegistry registry, ObjectMapper om, Clock clock) {
        return new JobAdmin(jobStore, registry, om, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStatsService jobStatsService(JobStore jobStore, Clock clock) {
        return new JobStatsService(jobStore, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronhiveLifecycle cronhiveLifecycle(Cronhive cronhive, CronhiveProperties props) {
        return new CronhiveLifecycle(cronhive, props.isAutoStart());
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronhive", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronhiveIndexesInitializer(CronhiveMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

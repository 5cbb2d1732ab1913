package io.sandcron.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sandcron.ExecutionRunner;
import io.sandcron.SandboxCommandFactory;
import io.sandcron.TaskScheduler;
import io.sandcron.TaskStore;
import io.sandcron.internal.PollingTaskScheduler;
import io.sandcron.internal.mongo.MongoTaskStore;
import io.sandcron.internal.sandbox.DockerSandboxCommandFactory;
import io.sandcron.internal.sandbox.ProcessSandboxRunner;
import io.sandcron.internal.sandbox.RunOutputJournal;
import io.sandcron.utils.OutputProtocolParser;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the task scheduler.
 */
@AutoConfiguration
@ConditionalOnClass({TaskScheduler.class, MongoTemplate.class})
@ConditionalOnProperty(prefix = "sandcron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SandcronAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "sandcron")
    public SchedulerProperties sandcronProperties() {
        return new SchedulerProperties();
    }

    @Bean
    @ConditionalOnMissingBean(TaskStore.class)
    public MongoTaskStore mongoTaskStore(MongoTemplate mongoTemplate) {
        return new MongoTaskStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected SandcronMongoIndexConfig sandcronMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new SandcronMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutputProtocolParser outputProtocolParser(ObjectProvider<ObjectMapper> objectMapper) {
        return new OutputProtocolParser(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public SandboxCommandFactory sandboxCommandFactory(SchedulerProperties props) {
        return new DockerSandboxCommandFactory(props.getSandbox());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionRunner executionRunner(SchedulerProperties props,
                                           SandboxCommandFactory commandFactory,
                                           OutputProtocolParser parser,
                                           ObjectProvider<ObjectMapper> objectMapper) {
        return new ProcessSandboxRunner(props, commandFactory, parser, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "sandcron", name = "journal-enabled", havingValue = "true", matchIfMissing = true)
    public RunOutputJournal runOutputJournal(SchedulerProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new RunOutputJournal(props.getLogsDir(), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskScheduler taskScheduler(SchedulerProperties props,
                                       TaskStore taskStore,
                                       ExecutionRunner runner,
                                       ObjectProvider<RunOutputJournal> journal) {
        return new PollingTaskScheduler(props, taskStore, runner, journal.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(TaskScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "sandcron", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton sandcronIndexesInitializer(SandcronMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

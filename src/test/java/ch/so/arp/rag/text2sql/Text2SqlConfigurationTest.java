package ch.so.arp.rag.text2sql;

import static org.assertj.core.api.Assertions.assertThat;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import ch.so.arp.rag.text2sql.generation.LlmClient;
import ch.so.arp.rag.text2sql.generation.MockLlmClient;
import ch.so.arp.rag.text2sql.generation.OpenAiLlmClient;
import ch.so.arp.rag.text2sql.knowledge.DeterministicEmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.EmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.InMemoryKnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.OpenAiEmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.PostgresKnowledgeBase;
import ch.so.arp.rag.text2sql.metadata.JdbcMetadataExtractor;
import ch.so.arp.rag.text2sql.metadata.MetadataExtractor;
import ch.so.arp.rag.text2sql.metadata.SchemaFileMetadataExtractor;
import ch.so.arp.rag.text2sql.rules.BusinessRuleStore;
import ch.so.arp.rag.text2sql.validation.JdbcSqlExecutor;
import ch.so.arp.rag.text2sql.validation.SqlExecutor;

class Text2SqlConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Text2SqlConfiguration.class, InfrastructureConfiguration.class);

    @Test
    void usesMocksByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(LlmClient.class);
            assertThat(context).getBean(LlmClient.class).isInstanceOf(MockLlmClient.class);
            assertThat(context).hasSingleBean(EmbeddingProvider.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(DeterministicEmbeddingProvider.class);
            assertThat(context).hasSingleBean(KnowledgeBase.class);
            assertThat(context).getBean(KnowledgeBase.class).isInstanceOf(InMemoryKnowledgeBase.class);
            assertThat(context).getBean(MetadataExtractor.class).isInstanceOf(JdbcMetadataExtractor.class);
            assertThat(context).getBean(SqlExecutor.class).isInstanceOf(JdbcSqlExecutor.class);
            assertThat(context).hasSingleBean(Text2SqlService.class);
            assertThat(context).doesNotHaveBean(ApplicationRunner.class);
        });
    }

    @Test
    void createsRealBeansWhenMocksDisabled() {
        contextRunner
                .withPropertyValues(
                        "rag.text2sql.mock-openai=false",
                        "rag.text2sql.mock-vector-store=false",
                        "spring.ai.openai.api-key=test-key",
                        "rag.text2sql.openai.base-url=https://example.com/v1",
                        "rag.text2sql.openai.model=gpt-4o")
                .run(context -> {
                    assertThat(context).hasSingleBean(LlmClient.class);
                    assertThat(context).getBean(LlmClient.class).isInstanceOf(OpenAiLlmClient.class);
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(OpenAiEmbeddingProvider.class);
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getModel()).isEqualTo("gpt-4o");

                    assertThat(context).hasSingleBean(KnowledgeBase.class);
                    assertThat(context).getBean(KnowledgeBase.class).isInstanceOf(PostgresKnowledgeBase.class);
                });
    }

    @Test
    void failsWithoutApiKeyWhenMocksDisabled() {
        contextRunner
                .withPropertyValues("rag.text2sql.mock-openai=false")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void readsSchemaFileAndBusinessRules() {
        contextRunner
                .withPropertyValues(
                        "rag.text2sql.metadata.source=schema-file",
                        "rag.text2sql.metadata.schema-file=classpath:schema/shop-schema.json",
                        "rag.text2sql.knowledge-base.business-rules-location=classpath:rules/shop-rules.yml")
                .run(context -> {
                    assertThat(context).getBean(MetadataExtractor.class)
                            .isInstanceOf(SchemaFileMetadataExtractor.class);
                    assertThat(context.getBean(BusinessRuleStore.class).size()).isEqualTo(8);
                });
    }

    @Test
    void schemaFileSourceRequiresLocation() {
        contextRunner
                .withPropertyValues("rag.text2sql.metadata.source=schema-file")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void buildsKnowledgeBaseOnStartupWhenEnabled() {
        contextRunner
                .withPropertyValues(
                        "rag.text2sql.metadata.source=schema-file",
                        "rag.text2sql.metadata.schema-file=classpath:schema/shop-schema.json",
                        "rag.text2sql.knowledge-base.build-on-startup=true",
                        "rag.text2sql.knowledge-base.mock-embedding-dimensions=256")
                .run(context -> {
                    assertThat(context).hasSingleBean(ApplicationRunner.class);
                    context.getBean(ApplicationRunner.class).run(new DefaultApplicationArguments());
                    KnowledgeBase knowledgeBase = context.getBean(KnowledgeBase.class);
                    assertThat(knowledgeBase.tableNames()).contains("orders", "users");
                    assertThat(context.getBean(Text2SqlService.class).stats().embeddingModel())
                            .isEqualTo("deterministic-256");
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class InfrastructureConfiguration {

        @Bean
        JdbcClient jdbcClient(DataSource dataSource) {
            return JdbcClient.create(dataSource);
        }

        @Bean
        DataSource dataSource() {
            DriverManagerDataSource dataSource = new DriverManagerDataSource();
            dataSource.setDriverClassName("org.h2.Driver");
            dataSource.setUrl("jdbc:h2:mem:text2sql-config;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
            dataSource.setUsername("sa");
            dataSource.setPassword("");
            return dataSource;
        }
    }
}

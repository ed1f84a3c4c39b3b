package ch.so.arp.rag.text2sql.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.databind.ObjectMapper;

class SchemaFileMetadataExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsTablesSortedByName() {
        SchemaFileMetadataExtractor extractor = new SchemaFileMetadataExtractor(
                new ClassPathResource("schema/shop-schema.json"), objectMapper);

        List<TableMetadata> tables = extractor.extract();

        assertThat(tables).extracting(TableMetadata::name).containsExactly("orders", "users");
        TableMetadata orders = tables.get(0);
        assertThat(orders.comment()).isEqualTo("订单表");
        assertThat(orders.isPrimaryKey("id")).isTrue();
        assertThat(orders.foreignKey("user_id")).contains(new ForeignKeyRef("user_id", "users", "id"));
        assertThat(orders.column("payment_amount")).get().extracting(ColumnMetadata::type).isEqualTo("DECIMAL(10,2)");
    }

    @Test
    void rejectsMissingFile() {
        SchemaFileMetadataExtractor extractor = new SchemaFileMetadataExtractor(
                new ClassPathResource("schema/does-not-exist.json"), objectMapper);

        assertThatThrownBy(extractor::extract)
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void rejectsDocumentWithoutTables() {
        SchemaFileMetadataExtractor extractor = new SchemaFileMetadataExtractor(
                new ByteArrayResource("{\"views\": []}".getBytes(StandardCharsets.UTF_8)), objectMapper);

        assertThatThrownBy(extractor::extract)
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("no 'tables' section");
    }

    @Test
    void rejectsMalformedJson() {
        SchemaFileMetadataExtractor extractor = new SchemaFileMetadataExtractor(
                new ByteArrayResource("{\"tables\": [".getBytes(StandardCharsets.UTF_8)), objectMapper);

        assertThatThrownBy(extractor::extract).isInstanceOf(ExtractionException.class);
    }
}

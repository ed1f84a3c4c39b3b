package ch.so.arp.rag.text2sql.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.text2sql.QueryOutcome;
import ch.so.arp.rag.text2sql.QueryResult;
import ch.so.arp.rag.text2sql.Text2SqlService;
import ch.so.arp.rag.text2sql.knowledge.BuildReport;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseSnapshotCodec;
import ch.so.arp.rag.text2sql.metadata.TableMetadata;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.RuleKind;

class Text2SqlControllerTest {

    private static final BuildReport REPORT = new BuildReport(false, 2, 3, 3, List.of(), List.of(), List.of(),
            Duration.ofMillis(12));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Text2SqlService service;
    private Text2SqlController controller;

    @BeforeEach
    void setUp() {
        service = mock(Text2SqlService.class);
        controller = new Text2SqlController(service, objectMapper);
    }

    @Test
    void delegatesQuestion() {
        QueryResult result = new QueryResult("统计订单数量", "SELECT COUNT(*) FROM orders", QueryOutcome.SUCCESS, 1,
                "SELECT COUNT(*) FROM orders", null, null, null);
        when(service.query("统计订单数量", true)).thenReturn(result);

        assertThat(controller.query(new QueryRequest("统计订单数量", true))).isSameAs(result);
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildParsesInlineRules() throws Exception {
        when(service.build(eq(true), anyCollection())).thenReturn(REPORT);
        BuildRequest request = new BuildRequest(true, objectMapper.readTree("""
                {"general_terms": {"GMV": "sum of paid orders"},
                 "synonyms": {"users": {"users": ["会员", "customers"]}}}
                """));

        assertThat(controller.build(request)).isSameAs(REPORT);

        ArgumentCaptor<Collection<BusinessRule>> rules = ArgumentCaptor.forClass(Collection.class);
        verify(service).build(eq(true), rules.capture());
        assertThat(rules.getValue()).extracting(BusinessRule::kind).containsExactly(RuleKind.TERM, RuleKind.SYNONYM);
    }

    @Test
    void buildWithoutBodyUsesDefaults() {
        when(service.build(false, List.of())).thenReturn(REPORT);

        assertThat(controller.build(null)).isSameAs(REPORT);
        verify(service).build(false, List.of());
    }

    @Test
    void schemaReturnsAllOrOneTable() {
        TableMetadata orders = new TableMetadata("orders", "订单表", List.of(), null, List.of());
        when(service.describeSchema()).thenReturn(List.of(orders));
        when(service.describeTable("orders")).thenReturn(Optional.of(orders));
        when(service.describeTable("payments")).thenReturn(Optional.empty());

        assertThat(controller.schema(null).getBody()).containsExactly(orders);
        assertThat(controller.schema("orders").getBody()).containsExactly(orders);
        assertThat(controller.schema("payments").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void newRuleIsCreatedAndExistingRuleReplaced() {
        BusinessRuleRequest request = new BusinessRuleRequest(null, RuleKind.METRIC, "GMV", "SUM(payment_amount)");
        BusinessRule previous = BusinessRule.general(RuleKind.METRIC, "GMV", "SUM(amount)");
        when(service.addBusinessRule(any())).thenReturn(Optional.empty(), Optional.of(previous));

        ResponseEntity<BusinessRule> created = controller.addBusinessRule(request);
        ResponseEntity<BusinessRule> replaced = controller.addBusinessRule(request);

        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(created.getBody().isGeneral()).isTrue();
        assertThat(replaced.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void importReportsChunkCount() {
        KnowledgeBaseSnapshotCodec.Snapshot snapshot = new KnowledgeBaseSnapshotCodec.Snapshot(List.of());
        when(service.importKnowledgeBase(snapshot)).thenReturn(0);

        assertThat(controller.importKnowledgeBase(snapshot).imported()).isZero();
    }
}

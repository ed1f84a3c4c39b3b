package ch.so.arp.rag.text2sql.knowledge;

import static ch.so.arp.rag.text2sql.knowledge.KnowledgeFixtures.ORDERS;
import static ch.so.arp.rag.text2sql.knowledge.KnowledgeFixtures.PRODUCTS;
import static ch.so.arp.rag.text2sql.knowledge.KnowledgeFixtures.USERS;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.BusinessRuleStore;
import ch.so.arp.rag.text2sql.rules.RuleKind;

class TableChunkerTest {

    private final TableChunker chunker = new TableChunker();

    @Test
    void rendersOneChunkPerTableWithStableIds() {
        List<KnowledgeChunk> chunks = chunker.chunk(List.of(ORDERS, USERS), new BusinessRuleStore());

        assertThat(chunks).extracting(KnowledgeChunk::id).containsExactly("table_orders", "table_users");
        assertThat(chunks).extracting(KnowledgeChunk::tableName).containsExactly("orders", "users");
        assertThat(chunks).allMatch(chunk -> !chunk.hasEmbedding());
    }

    @Test
    void tableChunkCarriesStructureAndRelationships() {
        KnowledgeChunk orders = chunker.chunk(List.of(ORDERS, USERS), new BusinessRuleStore()).get(0);

        assertThat(orders.text())
                .startsWith("# Table: orders\n\n## Description\n订单表\n")
                .contains("CREATE TABLE orders (")
                .contains("FOREIGN KEY (user_id) REFERENCES users (id)")
                .contains("- **id**: BIGINT NOT NULL - 订单ID (PK)")
                .contains("- **user_id**: BIGINT NOT NULL - 用户ID (FK -> users.id)")
                .contains("## Relationships\n- orders.user_id -> users.id")
                .contains("- **order_status**: 1 means '待支付', 2 means '已支付', 3 means '已退款'");
        assertThat(orders.metadata())
                .containsEntry(KnowledgeChunk.META_KIND, KnowledgeChunk.KIND_TABLE)
                .containsEntry(KnowledgeChunk.META_TABLE_NAME, "orders")
                .containsEntry(KnowledgeChunk.META_COLUMNS, "id,user_id,payment_amount,order_status")
                .containsEntry(KnowledgeChunk.META_FOREIGN_KEYS, "orders.user_id -> users.id");
    }

    @Test
    void referencedTableListsIncomingRelationships() {
        KnowledgeChunk users = chunker.chunk(List.of(ORDERS, USERS), new BusinessRuleStore()).get(1);

        assertThat(users.text()).contains("## Relationships\n- orders.user_id -> users.id");
    }

    @Test
    void mergesApplicableRulesIntoTableChunks() {
        BusinessRuleStore rules = new BusinessRuleStore(List.of(
                BusinessRule.forTable("orders", RuleKind.TERM, "domain", "sales"),
                BusinessRule.forTable("orders", RuleKind.TERM, "paid order", "order_status = 2"),
                BusinessRule.forTable("orders", RuleKind.SYNONYM, "payment_amount", "实付, paid amount"),
                BusinessRule.general(RuleKind.METRIC, "GMV", "SUM(orders.payment_amount)"),
                BusinessRule.general(RuleKind.METRIC, "会员数", "COUNT(*) FROM members")));

        List<KnowledgeChunk> chunks = chunker.chunk(List.of(ORDERS, USERS), rules);
        KnowledgeChunk orders = chunks.get(0);
        KnowledgeChunk users = chunks.get(1);

        assertThat(orders.text())
                .contains("## Business Terms\n- **paid order**: order_status = 2")
                .contains("## Metrics\n- **GMV**: SUM(orders.payment_amount)")
                .contains("  - payment_amount: 金额, 销售额, 实付, paid amount")
                .doesNotContain("**domain**")
                .doesNotContain("会员数");
        assertThat(orders.metadata()).containsEntry(KnowledgeChunk.META_DOMAIN, "sales");
        assertThat(users.text()).doesNotContain("GMV");
    }

    @Test
    void generalRulesProduceBusinessRulesChunk() {
        BusinessRuleStore rules = new BusinessRuleStore(List.of(
                BusinessRule.general(RuleKind.TERM, "活跃用户", "users with an order in the period"),
                BusinessRule.general(RuleKind.CALCULATION, "退款率", "refunded / all")));

        List<KnowledgeChunk> chunks = chunker.chunk(List.of(USERS), rules);

        assertThat(chunks).hasSize(2);
        KnowledgeChunk business = chunks.get(1);
        assertThat(business.id()).isEqualTo(KnowledgeChunk.BUSINESS_RULES_ID);
        assertThat(business.tableName()).isNull();
        assertThat(business.kind()).isEqualTo(KnowledgeChunk.KIND_BUSINESS_RULES);
        assertThat(business.text())
                .contains("## General Terms\n- **活跃用户**: users with an order in the period")
                .contains("## Calculation Rules\n- **退款率**: refunded / all");
    }

    @Test
    void describesTableWithoutCommentFromTermOrColumns() {
        KnowledgeChunk plain = chunker.chunk(List.of(PRODUCTS), new BusinessRuleStore()).get(0);
        assertThat(plain.text()).contains("## Description\nTable products with columns id, price.");
        assertThat(plain.text()).contains("- Table: 产品, 商品").contains("  - price: 价格, 金额");

        BusinessRuleStore rules = new BusinessRuleStore(List.of(
                BusinessRule.forTable("products", RuleKind.TERM, "description", "catalogue items")));
        KnowledgeChunk described = chunker.chunk(List.of(PRODUCTS), rules).get(0);
        assertThat(described.text()).contains("## Description\ncatalogue items\n");
    }

    @Test
    void renderingIsDeterministic() {
        BusinessRuleStore rules = new BusinessRuleStore(List.of(
                BusinessRule.general(RuleKind.METRIC, "GMV", "SUM(orders.payment_amount)")));

        assertThat(chunker.chunk(List.of(ORDERS, USERS), rules)).isEqualTo(chunker.chunk(List.of(ORDERS, USERS), rules));
    }
}

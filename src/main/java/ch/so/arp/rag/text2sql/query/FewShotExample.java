package ch.so.arp.rag.text2sql.query;

import java.util.List;
import java.util.Locale;

/**
 * Worked question and answer pair shown to the model.
 */
public record FewShotExample(String question, String sql, String note) {

    static final List<FewShotExample> DEFAULTS = List.of(
            new FewShotExample("查询上周的总销售额",
                    "SELECT SUM(payment_amount) FROM orders WHERE created_at >= DATE_SUB(CURRENT_DATE(), INTERVAL 7 DAY)",
                    "orders表包含payment_amount和created_at字段"),
            new FewShotExample("统计每个城市的用户数量",
                    "SELECT city, COUNT(*) AS user_count FROM users GROUP BY city",
                    "users表包含city字段"),
            new FewShotExample("找出订单金额最高的前10个用户",
                    "SELECT u.user_id, u.username, SUM(o.payment_amount) AS total_amount FROM users u "
                            + "JOIN orders o ON u.user_id = o.user_id GROUP BY u.user_id, u.username "
                            + "ORDER BY total_amount DESC LIMIT 10",
                    "users和orders表通过user_id关联"));

    boolean uses(String keyword) {
        return sql.toUpperCase(Locale.ROOT).contains(keyword);
    }
}

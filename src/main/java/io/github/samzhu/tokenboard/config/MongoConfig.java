package io.github.samzhu.tokenboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.convert.DbRefResolver;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用以下功能：
 * <ul>
 *   <li>Repository 自動掃描 - 自動註冊 {@code io.github.samzhu.tokenboard.repository} 下的介面</li>
 *   <li>多文件交易 - 合併提交時所有日明細與用戶累計在同一交易中寫入（需 replica set）</li>
 *   <li>Map key 跳脫 - 模型名稱如 {@code gpt-4.1} 含有 {@code .}，寫入時替換為全形句點</li>
 * </ul>
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code daily_breakdown} - 用戶日明細（依來源、裝置分區）</li>
 *   <li>{@code submission_summary} - 用戶累計統計</li>
 *   <li>{@code api_tokens} - 裝置 API token</li>
 *   <li>{@code users} - 用戶帳號</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/client-session-transactions.html">Sessions &amp; Transactions</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.tokenboard.repository")
public class MongoConfig {

    /** 全形句點，用於取代 map key 中的 {@code .} */
    static final String MAP_KEY_DOT_REPLACEMENT = "．";

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public TransactionTemplate transactionTemplate(MongoTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public MappingMongoConverter mappingMongoConverter(
            MongoDatabaseFactory databaseFactory,
            MongoMappingContext mappingContext,
            MongoCustomConversions conversions) {
        DbRefResolver dbRefResolver = new DefaultDbRefResolver(databaseFactory);
        MappingMongoConverter converter = new MappingMongoConverter(dbRefResolver, mappingContext);
        converter.setCustomConversions(conversions);
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        return converter;
    }
}

package io.lighting.metakit.starter;

import io.lighting.metakit.db.PaginationObserver;
import io.lighting.metakit.db.SqlLog;
import io.lighting.metakit.jdbc.JdbcExecutor;
import io.lighting.metakit.optimize.QueryOptimizer;
import io.lighting.metakit.page.Paginator;
import io.lighting.metakit.page.SqlPaginator;
import io.lighting.metakit.sql.Dialect;
import io.lighting.metakit.sql.dialect.DialectResolver;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@ConditionalOnClass(Paginator.class)
@EnableConfigurationProperties(MetakitProperties.class)
public class MetakitAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetakitAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public QueryOptimizer queryOptimizer(MetakitProperties properties) {
        return new QueryOptimizer(properties.getOptimizer().build());
    }

    @Bean
    @ConditionalOnMissingBean
    public List<PaginationObserver> paginationObservers(MetakitProperties properties) {
        SqlLog sqlLog = properties.getSql().getLog().build(LOGGER::info);
        if (sqlLog == null) {
            return List.of();
        }
        return List.of(sqlLog);
    }

    @Bean
    @ConditionalOnMissingBean
    public Paginator paginator(
        MetakitProperties properties,
        List<PaginationObserver> observers,
        ObjectProvider<Dialect> dialect
    ) {
        Paginator.Builder builder = Paginator.builder()
            .observers(observers)
            .debugLog(SqlLog.debug(LOGGER::info))
            .invalidCursorPolicy(properties.getCursor().getInvalidPolicy());
        dialect.ifAvailable(builder::dialect);
        return builder.build();
    }

    @Bean
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnMissingBean
    public Dialect dialect(MetakitProperties properties, DataSource dataSource) {
        String configured = properties.getDialect();
        if (configured != null && !configured.isBlank()) {
            return DialectResolver.parse(configured);
        }
        return DialectResolver.resolve(dataSource);
    }

    @Bean
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnMissingBean
    public JdbcExecutor jdbcExecutor(DataSource dataSource) {
        return new JdbcExecutor(dataSource);
    }

    @Bean
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnMissingBean
    public SqlPaginator sqlPaginator(JdbcExecutor executor, List<PaginationObserver> observers) {
        return SqlPaginator.builder(executor)
            .observers(observers)
            .debugLog(SqlLog.debug(LOGGER::info))
            .build();
    }
}

package io.intellixity.mapflow.examples.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.mapflow.engine.compile.AnonymousSourceCompiler;
import io.intellixity.mapflow.engine.compile.FunctionReferenceResolver;
import io.intellixity.mapflow.engine.compile.QuerySyntaxValidator;
import io.intellixity.mapflow.engine.exec.QueryDriver;
import io.intellixity.mapflow.engine.phase.PhaseBehaviorClassifier;
import io.intellixity.mapflow.examples.engine.LoggingFlowEngine;
import io.intellixity.mapflow.exec.FlowEngine;
import io.intellixity.mapflow.store.InMemoryKeyValueStore;
import io.intellixity.mapflow.store.KeyValueStore;
import io.intellixity.mapflow.store.jdbc.JdbcKeyValueStore;
import io.intellixity.mapflow.store.jdbc.JdbcStoreHandle;
import io.intellixity.mapflow.store.mongo.MongoKeyValueStore;
import io.intellixity.mapflow.store.mongo.MongoStoreHandle;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MapflowProperties.class)
public class MapflowExampleConfig {

  @Bean
  @ConditionalOnProperty(prefix = "mapflow.store", name = "kind", havingValue = "memory", matchIfMissing = true)
  public KeyValueStore inMemoryKeyValueStore() {
    return new InMemoryKeyValueStore();
  }

  @Bean
  @ConditionalOnProperty(prefix = "mapflow.store", name = "kind", havingValue = "mongo")
  public MongoClient mongoClient(MapflowProperties props) {
    return MongoClients.create(props.getStore().getMongo().getUri());
  }

  @Bean
  @ConditionalOnProperty(prefix = "mapflow.store", name = "kind", havingValue = "mongo")
  public KeyValueStore mongoKeyValueStore(MongoClient client, MapflowProperties props) {
    String database = props.getStore().getMongo().getDatabase();
    return new MongoKeyValueStore(new MongoStoreHandle("mongo:" + database, client, database));
  }

  @Bean
  @ConditionalOnProperty(prefix = "mapflow.store", name = "kind", havingValue = "jdbc")
  public HikariDataSource mapredDataSource(MapflowProperties props) {
    MapflowProperties.Jdbc jdbc = props.getStore().getJdbc();
    if (jdbc.getUrl() == null || jdbc.getUrl().isBlank()) {
      throw new IllegalArgumentException("mapflow.store.jdbc.url is required when mapflow.store.kind=jdbc");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(jdbc.getUrl());
    hc.setUsername(jdbc.getUsername());
    hc.setPassword(jdbc.getPassword());
    hc.setMaximumPoolSize(jdbc.getMaximumPoolSize());
    hc.setReadOnly(true);
    return new HikariDataSource(hc);
  }

  @Bean
  @ConditionalOnProperty(prefix = "mapflow.store", name = "kind", havingValue = "jdbc")
  public KeyValueStore jdbcKeyValueStore(HikariDataSource ds, MapflowProperties props) {
    MapflowProperties.Jdbc jdbc = props.getStore().getJdbc();
    return new JdbcKeyValueStore(new JdbcStoreHandle("jdbc:" + jdbc.getUrl(), ds, jdbc.getSchema()), jdbc.getTable());
  }

  @Bean
  public AnonymousSourceCompiler anonymousSourceCompiler() {
    return new AnonymousSourceCompiler();
  }

  @Bean
  public QuerySyntaxValidator querySyntaxValidator(KeyValueStore store) {
    return new QuerySyntaxValidator(new FunctionReferenceResolver(store), new PhaseBehaviorClassifier());
  }

  @Bean
  public FlowEngine flowEngine() {
    return new LoggingFlowEngine();
  }

  @Bean
  public QueryDriver queryDriver(QuerySyntaxValidator validator, FlowEngine flowEngine) {
    return new QueryDriver(validator, flowEngine);
  }
}

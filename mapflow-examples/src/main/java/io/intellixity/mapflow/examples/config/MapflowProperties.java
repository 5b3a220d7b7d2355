package io.intellixity.mapflow.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mapflow")
public class MapflowProperties {
  /** Node name handed to the flow engine. */
  private String node = "local";

  /** Used when a submitted job carries no timeout. */
  private long defaultTimeoutMs = 60_000L;

  private final Store store = new Store();

  public String getNode() { return node; }
  public void setNode(String node) { this.node = node; }
  public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
  public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
  public Store getStore() { return store; }

  public static class Store {
    /** memory | mongo | jdbc */
    private String kind = "memory";
    private final Mongo mongo = new Mongo();
    private final Jdbc jdbc = new Jdbc();

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public Mongo getMongo() { return mongo; }
    public Jdbc getJdbc() { return jdbc; }
  }

  public static class Mongo {
    private String uri = "mongodb://localhost:27017";
    private String database = "mapflow";

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Jdbc {
    private String url;
    private String username;
    private String password;
    private String schema = "public";
    private String table = "mapred_objects";
    private int maximumPoolSize = 10;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public String getTable() { return table; }
    public void setTable(String table) { this.table = table; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }
}

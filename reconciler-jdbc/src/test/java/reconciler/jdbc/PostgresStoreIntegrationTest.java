package reconciler.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reconciler.jdbc.dialect.Dialects;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresStoreIntegrationTest extends AbstractStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("reconciler_test");

  private static final JdbcStores STORES = JdbcStores.builder(Dialects.get("postgresql")).build();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    Schemas.apply(dataSource, "/schema/postgresql.sql");
  }

  @BeforeEach
  void truncate() throws Exception {
    Schemas.truncateAll(dataSource);
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  JdbcStores stores() {
    return STORES;
  }
}

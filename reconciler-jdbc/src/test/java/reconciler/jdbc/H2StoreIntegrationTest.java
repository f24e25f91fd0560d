package reconciler.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reconciler.jdbc.dialect.H2Dialect;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class H2StoreIntegrationTest extends AbstractStoreIntegrationTest {
  private DataSource dataSource;
  private JdbcStores stores;

  @BeforeEach
  void setup() throws Exception {
    dataSource = Schemas.h2();
    stores = JdbcStores.detect(dataSource);
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  JdbcStores stores() {
    return stores;
  }

  @Test
  void detectsH2Dialect() {
    assertInstanceOf(H2Dialect.class, stores.dialect());
  }
}

package reconciler.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the drainers, the sweeper and the feedback receiver.
 *
 * <p>Callers close the returned connection.
 *
 * @see reconciler.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}

package in.the13th.intel.testing;

import in.the13th.intel.migration.IntelSchemaMigration;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Fresh, migrated in-memory H2 database per call.
 */
public final class TestDatabase {

    public static DataSource create() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:intel-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
        new IntelSchemaMigration(ds).migrate();
        return ds;
    }

    private TestDatabase() {}
}

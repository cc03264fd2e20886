package db.migration;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V2__hit_screenshot_lookup_index extends BaseJavaMigration {
  private static final String INDEX_NAME = "idx_hits_screenshot_lookup";

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    String sql =
        "CREATE INDEX IF NOT EXISTS "
            + INDEX_NAME
            + " ON hits (task_id, sub_url, matched_keyword, id)";
    if (isPostgres(connection)) {
      // only unattached rows are ever looked up
      sql = sql + " WHERE screenshot_path IS NULL OR screenshot_path = ''";
    }
    try (Statement statement = connection.createStatement()) {
      statement.executeUpdate(sql);
    }
  }

  private boolean isPostgres(Connection connection) throws SQLException {
    DatabaseMetaData metaData = connection.getMetaData();
    String productName = metaData == null ? null : metaData.getDatabaseProductName();
    return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
  }
}

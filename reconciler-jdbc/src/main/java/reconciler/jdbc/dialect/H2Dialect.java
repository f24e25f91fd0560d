package reconciler.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>Uses the token-guarded two-phase claim from {@link AbstractDialect}.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}

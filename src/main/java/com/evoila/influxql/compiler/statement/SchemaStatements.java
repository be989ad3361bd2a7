package com.evoila.influxql.compiler.statement;

import com.evoila.influxql.compiler.model.dto.QuotingMode;
import com.evoila.influxql.compiler.utils.ValidationUtils;
import java.util.Arrays;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/** Fixed schema exploration and database management statements. */
@Slf4j
public final class SchemaStatements {

  private static final String DATABASE_NAME = "Database name";

  private SchemaStatements() {
    // Utility class - prevent instantiation
  }

  /** Schema exploration statements that take no arguments. */
  @Getter
  public enum Show {
    DATABASES("databases", "SHOW DATABASES"),
    MEASUREMENTS("measurements", "SHOW MEASUREMENTS"),
    TAG_KEYS("tag-keys", "SHOW TAG KEYS"),
    FIELD_KEYS("field-keys", "SHOW FIELD KEYS");

    /** -- GETTER -- Name used to select the statement in API paths */
    private final String pathName;

    /** -- GETTER -- The statement text */
    private final String statement;

    Show(String pathName, String statement) {
      this.pathName = pathName;
      this.statement = statement;
    }

    /**
     * Parse a statement from its path name (case-insensitive)
     *
     * @param pathName e.g. "tag-keys"
     * @return the corresponding statement
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static Show fromPathName(String pathName) {
      if (pathName == null) {
        throw new IllegalArgumentException("Statement name cannot be null");
      }

      return Arrays.stream(values())
          .filter(show -> show.pathName.equalsIgnoreCase(pathName.trim()))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("Unknown statement: " + pathName));
    }
  }

  public static String show(Show show) {
    return show.getStatement();
  }

  public static String createDatabase(String name) {
    ValidationUtils.validateIdentifier(name, DATABASE_NAME);
    log.debug("SchemaStatements: Building CREATE DATABASE for '{}'", name);
    return "CREATE DATABASE " + QuotingMode.IDENTIFIER.quote(name);
  }

  public static String dropDatabase(String name) {
    ValidationUtils.validateIdentifier(name, DATABASE_NAME);
    log.debug("SchemaStatements: Building DROP DATABASE for '{}'", name);
    return "DROP DATABASE " + QuotingMode.IDENTIFIER.quote(name);
  }
}

package com.splitduck.exception;

import com.splitduck.test.TestBase;
import com.splitduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Error handling")
public class ErrorHandlingTest extends TestBase {

    @Nested
    @DisplayName("User errors")
    class UserErrors {

        @Test
        @DisplayName("Column not found enumerates the available columns")
        void testColumnNotFound() {
            ColumnNotFoundException e = new ColumnNotFoundException("Species", List.of("id", "species_name"));

            assertThat(e.getMessage()).isEqualTo("Column 'Species' not found. Available columns: [id, species_name]");
            assertThat(e.getColumn()).isEqualTo("Species");
            assertThat(e.getAvailableColumns()).containsExactly("id", "species_name");
            assertThat(e.isUserError()).isTrue();
            assertThat(e.getUserMessage()).startsWith("Column not found: ");
        }

        @Test
        @DisplayName("Every input error kind is a user error")
        void testUserErrorKinds() {
            assertThat(new InvalidArgumentException("bad").isUserError()).isTrue();
            assertThat(new NoCategoriesFoundException("c").isUserError()).isTrue();
            assertThat(new UnsupportedFormatException("x").isUserError()).isTrue();
            assertThat(new InvalidArgumentException("bad").getUserMessage()).isEqualTo("Invalid argument: bad");
        }
    }

    @Nested
    @DisplayName("Engine errors")
    class EngineErrors {

        @Test
        @DisplayName("Statistics error keeps the failed SQL")
        void testStatisticsError() {
            SQLException cause = new SQLException("Binder Error: column not found");
            StatisticsException e = new StatisticsException("count failed", cause, "SELECT 1");

            assertThat(e.isUserError()).isFalse();
            assertThat(e.getFailedSQL()).isEqualTo("SELECT 1");
            assertThat(e.getTechnicalMessage()).contains("SELECT 1").contains("Binder Error");
        }

        @Test
        @DisplayName("Missing files are reported as file not found")
        void testIOErrorTranslation() {
            QueryExecutionException e = new QueryExecutionException(
                "IO Error: No files found that match the pattern \"x.csv\"", "SELECT * FROM read_csv('x.csv')");

            assertThat(e.getUserMessage()).startsWith("File not found");
            assertThat(e.isUserError()).isFalse();
        }

        @Test
        @DisplayName("Conversion errors name the value and type")
        void testConversionErrorTranslation() {
            QueryExecutionException e = new QueryExecutionException(
                "Conversion Error: Could not convert string \"abc\" to 'INTEGER'", null);

            assertThat(e.getUserMessage()).contains("'abc'").contains("INTEGER");
        }

        @Test
        @DisplayName("Memory errors suggest lowering parallelism")
        void testOutOfMemoryTranslation() {
            QueryExecutionException e = new QueryExecutionException("Out of Memory Error: failed", null);
            assertThat(e.getUserMessage()).contains("--jobs");
        }

        @Test
        @DisplayName("Technical message includes SQL and cause")
        void testTechnicalMessage() {
            QueryExecutionException e = new QueryExecutionException(
                "failed", new SQLException("boom"), "SELECT 2");

            assertThat(e.getTechnicalMessage())
                .contains("Failed SQL:\nSELECT 2")
                .contains("java.sql.SQLException")
                .contains("boom");
        }
    }
}

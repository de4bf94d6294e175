package com.splitduck.runtime;

import com.splitduck.exception.QueryExecutionException;
import com.splitduck.test.TestBase;
import com.splitduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DuckDB runtime")
public class DuckDBRuntimeTest extends TestBase {

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Jobs must be positive")
        void testJobsValidation() {
            assertThatThrownBy(() -> RuntimeConfig.defaults().withJobs(0))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(RuntimeConfig.defaults().withJobs(3).jobs()).hasValue(3);
            assertThat(RuntimeConfig.defaults().jobs()).isEmpty();
        }

        @Test
        @DisplayName("Memory limit property is honored when well formed")
        void testMemoryLimitProperty() {
            try {
                System.setProperty(RuntimeConfig.PROP_MEMORY_LIMIT, "1GB");
                assertThat(RuntimeConfig.defaults().memoryLimit()).isEqualTo("1GB");

                System.setProperty(RuntimeConfig.PROP_MEMORY_LIMIT, "plenty");
                assertThat(RuntimeConfig.defaults().memoryLimit()).isNull();
            } finally {
                System.clearProperty(RuntimeConfig.PROP_MEMORY_LIMIT);
            }
        }

        @Test
        @DisplayName("Byte counts are formatted with binary units")
        void testFormatBytes() {
            assertThat(HardwareProfile.formatBytes(512)).isEqualTo("512B");
            assertThat(HardwareProfile.formatBytes(2048)).isEqualTo("2KB");
            assertThat(HardwareProfile.formatBytes(3L * 1024 * 1024)).isEqualTo("3MB");
            assertThat(HardwareProfile.formatBytes(5L * 1024 * 1024 * 1024)).isEqualTo("5GB");
        }

        @Test
        @DisplayName("Hardware recommendations are usable")
        void testHardwareProfile() {
            HardwareProfile profile = HardwareProfile.detect();
            assertThat(profile.cpuCores()).isPositive();
            assertThat(profile.recommendedThreadCount()).isEqualTo(profile.cpuCores());
            assertThat(profile.recommendedMemoryLimit()).matches("\\d+(GB|MB|KB|B)");
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Thread count follows jobs")
        void testThreads() {
            try (DuckDBRuntime runtime = DuckDBRuntime.create(RuntimeConfig.defaults().withJobs(2))) {
                QueryExecutor executor = new QueryExecutor(runtime);
                assertThat(executor.getRuntime()).isSameAs(runtime);
                assertThat(executor.queryForLong("SELECT current_setting('threads')")).isEqualTo(2L);
                assertThat(runtime.getHardwareProfile()).isNotNull();
                assertThat(runtime.getConfig().jobs()).hasValue(2);
            }
        }

        @Test
        @DisplayName("Closed runtime refuses further use")
        void testClose() {
            DuckDBRuntime runtime = DuckDBRuntime.create();
            runtime.close();
            runtime.close();

            assertThat(runtime.isClosed()).isTrue();
            assertThatThrownBy(runtime::getConnection)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
        }

        @Test
        @DisplayName("A database file outlives the runtime")
        void testPersistentDatabase(@TempDir Path dir) {
            RuntimeConfig config = RuntimeConfig.defaults()
                .withJdbcUrl("jdbc:duckdb:" + dir.resolve("store.duckdb"));

            try (DuckDBRuntime runtime = DuckDBRuntime.create(config)) {
                QueryExecutor executor = new QueryExecutor(runtime);
                assertThat(executor.execute("CREATE TABLE kept AS SELECT range AS id FROM range(4)")).isFalse();
            }
            try (DuckDBRuntime runtime = DuckDBRuntime.create(config)) {
                assertThat(new QueryExecutor(runtime).queryForLong("SELECT count(*) FROM kept")).isEqualTo(4L);
            }
        }
    }

    @Nested
    @DisplayName("Query execution")
    class Execution {

        @Test
        @DisplayName("Results expose columns by name")
        void testQueryResult() {
            try (DuckDBRuntime runtime = DuckDBRuntime.create()) {
                QueryResult result = new QueryExecutor(runtime)
                    .executeQuery("SELECT range AS id, range * 10 AS score FROM range(3)");

                assertThat(result.rowCount()).isEqualTo(3);
                assertThat(result.columnIndex("score")).isEqualTo(1);
                assertThat(result.column("score")).containsExactly(0L, 10L, 20L);
                assertThatThrownBy(() -> result.columnIndex("missing"))
                    .isInstanceOf(IllegalArgumentException.class);
            }
        }

        @Test
        @DisplayName("Failures carry the failed SQL")
        void testFailure() {
            try (DuckDBRuntime runtime = DuckDBRuntime.create()) {
                QueryExecutor executor = new QueryExecutor(runtime);
                assertThatThrownBy(() -> executor.executeUpdate("DROP TABLE no_such_table"))
                    .isInstanceOf(QueryExecutionException.class)
                    .satisfies(e -> {
                        QueryExecutionException qe = (QueryExecutionException) e;
                        assertThat(qe.getFailedSQL()).isEqualTo("DROP TABLE no_such_table");
                        assertThat(qe.getUserMessage()).startsWith("Table or file error");
                        assertThat(qe.isUserError()).isFalse();
                    });
            }
        }
    }
}

package tech.andrefsramos.product_watcher.adapters.outbound.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.persistence.Column;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.SneakyThrows;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.product_watcher.adapters.outbound.persistence.entity.AlertEntity;
import tech.andrefsramos.product_watcher.adapters.outbound.persistence.entity.WatcherEntity;
import tech.andrefsramos.product_watcher.core.domain.WatcherStatus;

/** O script de produção precisa acompanhar o mapeamento, já que o Hibernate só valida. */
class MySqlSchemaScriptTest {

    private static final String SCRIPT = "db/schema-mysql.sql";

    @ParameterizedTest
    @ValueSource(classes = {WatcherEntity.class, AlertEntity.class})
    void shouldCreateEveryMappedColumnAndIndex(Class<?> entity) {
        // given
        Table table = entity.getAnnotation(Table.class);

        // when
        var ddl = tableDdl(table.name());

        // then
        for (String column : mappedColumns(entity)) {
            assertThat(ddl).containsPattern("(?m)^\\s*" + column + "\\s");
        }
        for (Index index : table.indexes()) {
            assertThat(ddl).contains("INDEX " + index.name());
        }
        assertThat(ddl).contains("PRIMARY KEY (id)");
    }

    @Test
    void shouldAcceptEveryWatcherStatus() {
        // when
        var ddl = tableDdl("watchers");

        // then
        for (WatcherStatus status : WatcherStatus.values()) {
            assertThat(ddl).contains("'" + status.name() + "'");
        }
    }

    @Test
    void shouldBeSafeToRunOnEveryStartup() {
        // when
        var script = readScript();

        // then
        assertThat(script).doesNotContainIgnoringCase("DROP ");
        assertThat(script.split("CREATE TABLE", -1)).hasSize(3);
        assertThat(script.split("CREATE TABLE IF NOT EXISTS", -1)).hasSize(3);
    }

    private static List<String> mappedColumns(Class<?> entity) {
        var columns = new ArrayList<String>();
        for (Field field : entity.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) continue;
            Column column = field.getAnnotation(Column.class);
            columns.add(column != null && !column.name().isBlank() ? column.name() : field.getName());
        }
        return columns;
    }

    private static String tableDdl(String table) {
        Matcher m = Pattern.compile("CREATE TABLE IF NOT EXISTS " + table + " \\((.*?)\\) ENGINE", Pattern.DOTALL)
                .matcher(readScript());
        assertThat(m.find()).as("tabela %s no script", table).isTrue();
        return m.group(1);
    }

    @SneakyThrows
    private static String readScript() {
        try (InputStream in = MySqlSchemaScriptTest.class.getClassLoader().getResourceAsStream(SCRIPT)) {
            assertThat(in).as("script %s no classpath", SCRIPT).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

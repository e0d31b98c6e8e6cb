package me.ymssd.tsync.config;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.ymssd.tsync.schema.Table;
import org.apache.commons.lang.StringUtils;
import org.yaml.snakeyaml.Yaml;

/**
 * @author denghui
 * @create 2018/10/12
 */
@Data
@NoArgsConstructor
public class SyncConfig {

    public static final String CONFIG_FILE = "tsync.yaml";

    private int workers = Runtime.getRuntime().availableProcessors();
    private long initialRowsToHash = 256;
    private String snapshot;
    private List<String> only = new ArrayList<>();
    private List<String> ignore = new ArrayList<>();

    public static SyncConfig load(InputStream input) {
        Preconditions.checkNotNull(input, "config input is null");
        Yaml yaml = new Yaml();
        SyncConfig syncConfig = yaml.loadAs(input, SyncConfig.class);
        return syncConfig == null ? new SyncConfig() : syncConfig;
    }

    public static SyncConfig loadDefault() {
        return loadResource(CONFIG_FILE);
    }

    public static SyncConfig loadResource(String resource) {
        try (InputStream input = SyncConfig.class.getClassLoader().getResourceAsStream(resource)) {
            Preconditions.checkArgument(input != null, "config resource %s not found", resource);
            return load(input);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Whether a table should be synced: listed in {@code only} (when that is non-empty) and not
     * listed in {@code ignore}. Entries match either the bare or the schema qualified name.
     */
    public boolean isSelected(Table table) {
        if (only != null && !only.isEmpty() && !matches(only, table)) {
            return false;
        }
        return ignore == null || !matches(ignore, table);
    }

    private static boolean matches(List<String> names, Table table) {
        for (String name : names) {
            String trimmed = StringUtils.trimToEmpty(name);
            if (trimmed.equals(table.getName()) || trimmed.equals(table.idFromName())) {
                return true;
            }
        }
        return false;
    }
}

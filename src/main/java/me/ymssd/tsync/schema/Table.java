package me.ymssd.tsync.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang.StringUtils;

/**
 * Catalog description of one table, as read from the source database.
 *
 * @author denghui
 * @create 2018/10/9
 */
@Data
@NoArgsConstructor
public class Table {

    private String schema;
    private String name;
    private List<Column> columns = new ArrayList<>();
    private List<Integer> primaryKeyColumns = new ArrayList<>();

    public Table(String schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    public Table addColumn(Column column) {
        columns.add(column);
        return this;
    }

    public Table addPrimaryKeyColumn(Column column) {
        columns.add(column);
        primaryKeyColumns.add(columns.size() - 1);
        return this;
    }

    public String idFromName() {
        return StringUtils.isEmpty(schema) ? name : schema + "." + name;
    }

    public List<Column> getPrimaryKey() {
        return primaryKeyColumns.stream()
            .map(columns::get)
            .collect(Collectors.toList());
    }
}

package me.ymssd.tsync.schema;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author denghui
 * @create 2018/10/9
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Column {

    private String name;
    private ColumnType columnType = ColumnType.UNKNOWN;
}

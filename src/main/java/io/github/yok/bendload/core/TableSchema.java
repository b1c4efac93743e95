package io.github.yok.bendload.core;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Column declarations parsed from a schema string such as {@code a:uint8, b:uint64}.
 *
 * <p>
 * <strong>Syntax:</strong>
 * </p>
 * <ul>
 * <li>All whitespace is removed before parsing.</li>
 * <li>Fields are separated by {@code ,}; each field is {@code name:type}. Empty tokens around
 * {@code :} are ignored, so every field must yield exactly one name and one type.</li>
 * <li>A column name may appear only once.</li>
 * </ul>
 *
 * <p>
 * Columns keep their declaration order, which is the order used in the generated
 * {@code CREATE TABLE} statement and in the column list of every {@code INSERT}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class TableSchema {

    /**
     * One declared column.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    @RequiredArgsConstructor
    public static final class Column {
        private final String name;
        private final String type;
    }

    private final List<Column> columns;

    private TableSchema(List<Column> columns) {
        this.columns = ImmutableList.copyOf(columns);
    }

    /**
     * Parses a schema string.
     *
     * @param raw schema string
     * @return parsed schema
     * @throws LoadException with {@link LoadErrorKind#INVALID_SCHEMA} if the string is malformed or
     *         declares a column twice
     */
    public static TableSchema parse(String raw) {
        String compact = StringUtils.deleteWhitespace(StringUtils.defaultString(raw));
        ImmutableList.Builder<Column> columns = ImmutableList.builder();
        Set<String> seen = new HashSet<>();
        for (String field : compact.split(",", -1)) {
            List<String> elems = Arrays.stream(field.split(":", -1)).filter(e -> !e.isEmpty())
                    .collect(Collectors.toList());
            if (elems.size() != 2) {
                throw new LoadException(LoadErrorKind.INVALID_SCHEMA,
                        "Not a valid schema: '" + raw
                                + "', please input schema in format like a:uint8,b:uint64");
            }
            String name = elems.get(0);
            if (!seen.add(name)) {
                throw new LoadException(LoadErrorKind.INVALID_SCHEMA,
                        "Not a valid schema: '" + raw + "', column " + name
                                + " is declared more than once");
            }
            columns.add(new Column(name, elems.get(1)));
        }
        return new TableSchema(columns.build());
    }

    /**
     * Returns the columns in declaration order.
     *
     * @return immutable column list
     */
    public List<Column> getColumns() {
        return columns;
    }

    /**
     * Renders the column definitions of a {@code CREATE TABLE} statement.
     *
     * @return e.g. {@code a uint8, b uint64}
     */
    public String toColumnDefinitions() {
        return columns.stream().map(c -> c.getName() + " " + c.getType())
                .collect(Collectors.joining(", "));
    }

    /**
     * Renders the column list of an {@code INSERT} statement.
     *
     * @return e.g. {@code a, b}
     */
    public String toColumnList() {
        return columns.stream().map(Column::getName).collect(Collectors.joining(", "));
    }
}

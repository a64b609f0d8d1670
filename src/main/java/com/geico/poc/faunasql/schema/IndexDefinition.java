package com.geico.poc.faunasql.schema;

import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.Fql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An index to provision on a collection. Terms and values are field paths such as
 * {@code ["ref"]} or {@code ["data", "name"]}.
 */
public class IndexDefinition {

    private static final List<String> REF_PATH = Collections.singletonList("ref");

    private final String name;
    private final String source;
    private final List<List<String>> terms;
    private final List<List<String>> values;
    private final boolean unique;

    public IndexDefinition(String name, String source, List<List<String>> terms,
                           List<List<String>> values, boolean unique) {
        this.name = name;
        this.source = source;
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.unique = unique;
    }

    /**
     * The full index set a table needs: ref and all indexes, then per field the value and
     * sort indexes, a term index when unique, and the ref indexes when it is a foreign key.
     */
    public static List<IndexDefinition> forTable(String table, List<FieldMetadata> fields) {
        List<IndexDefinition> indexes = new ArrayList<>();
        indexes.add(new IndexDefinition(IndexNames.indexName(table, IndexKind.REF), table,
            Collections.singletonList(REF_PATH), Collections.emptyList(), false));
        indexes.add(new IndexDefinition(IndexNames.indexName(table), table,
            Collections.emptyList(), Collections.emptyList(), false));

        List<FieldMetadata> foreignKeys = new ArrayList<>();
        for (FieldMetadata field : fields) {
            if (field.isForeignKey()) {
                foreignKeys.add(field);
            }
        }

        for (FieldMetadata field : fields) {
            String column = field.getName();
            indexes.add(new IndexDefinition(IndexNames.indexName(table, column, IndexKind.VALUE), table,
                Collections.emptyList(), Arrays.asList(dataPath(column), REF_PATH), false));
            indexes.add(new IndexDefinition(IndexNames.indexName(table, column, IndexKind.SORT), table,
                Collections.singletonList(REF_PATH), Arrays.asList(dataPath(column), REF_PATH), false));
            if (field.isUnique()) {
                indexes.add(term(table, column, true));
            }
            if (field.isForeignKey()) {
                indexes.add(new IndexDefinition(IndexNames.indexName(table, column, IndexKind.REF), table,
                    Collections.singletonList(dataPath(column)), Collections.emptyList(), false));
                for (FieldMetadata sibling : foreignKeys) {
                    indexes.add(new IndexDefinition(
                        IndexNames.indexName(table, column, IndexKind.REF, sibling.getName()), table,
                        Collections.singletonList(dataPath(column)),
                        Arrays.asList(dataPath(sibling.getName()), REF_PATH), false));
                }
            }
        }
        return indexes;
    }

    public static IndexDefinition term(String table, String column, boolean unique) {
        return new IndexDefinition(IndexNames.indexName(table, column, IndexKind.TERM), table,
            Collections.singletonList(dataPath(column)), Collections.emptyList(), unique);
    }

    private static List<String> dataPath(String column) {
        return Arrays.asList("data", column);
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public List<List<String>> getTerms() {
        return terms;
    }

    public List<List<String>> getValues() {
        return values;
    }

    public boolean isUnique() {
        return unique;
    }

    public Expr toExpr() {
        List<Object> keysAndValues = new ArrayList<>(Arrays.asList("name", name, "source", Fql.collection(source)));
        if (!terms.isEmpty()) {
            keysAndValues.add("terms");
            keysAndValues.add(fieldList(terms));
        }
        if (!values.isEmpty()) {
            keysAndValues.add("values");
            keysAndValues.add(fieldList(values));
        }
        if (unique) {
            keysAndValues.add("unique");
            keysAndValues.add(true);
        }
        return Fql.obj(keysAndValues.toArray());
    }

    private static Expr fieldList(List<List<String>> paths) {
        List<Expr> fields = new ArrayList<>();
        for (List<String> path : paths) {
            fields.add(Fql.obj("field", Fql.value(path)));
        }
        return Fql.arr(fields);
    }

    @Override
    public String toString() {
        return name + " on " + source + " terms=" + terms + " values=" + values + (unique ? " unique" : "");
    }
}

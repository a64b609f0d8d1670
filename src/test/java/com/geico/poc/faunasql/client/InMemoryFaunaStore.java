package com.geico.poc.faunasql.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geico.poc.faunasql.errors.StoreException;
import com.geico.poc.faunasql.fql.Form;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Test store that evaluates queries in the JSON wire format against in-memory collections
 * and indexes. It follows the store's rules the translators rely on:
 *
 * <ul>
 *   <li>each query is a transaction; a failing query leaves no writes behind</li>
 *   <li>index entries are kept sorted, null values first; null terms are not indexed</li>
 *   <li>create and update drop null fields; update merges nested objects and replaces arrays</li>
 *   <li>deleting a collection drops its documents and indexes</li>
 * </ul>
 */
public class InMemoryFaunaStore implements StoreTransport {

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private static final Comparator<String> ID_ORDER =
        Comparator.<String>comparingInt(String::length).thenComparing(Comparator.<String>naturalOrder());

    private Map<String, CollectionState> collections = new LinkedHashMap<>();
    private Map<String, IndexState> indexes = new LinkedHashMap<>();
    private long nextId = 1;
    private long clock = 1;

    private final List<JsonNode> received = new ArrayList<>();
    private final Deque<StoreException> scheduledFailures = new ArrayDeque<>();

    @Override
    public synchronized JsonNode query(JsonNode expression) {
        received.add(expression);
        if (!scheduledFailures.isEmpty()) {
            throw scheduledFailures.poll();
        }

        Map<String, CollectionState> collectionsBefore = new LinkedHashMap<>();
        for (Map.Entry<String, CollectionState> entry : collections.entrySet()) {
            collectionsBefore.put(entry.getKey(), entry.getValue().copy());
        }
        Map<String, IndexState> indexesBefore = new LinkedHashMap<>(indexes);
        try {
            return encode(eval(expression, Env.EMPTY));
        } catch (StoreException e) {
            collections = collectionsBefore;
            indexes = indexesBefore;
            throw e;
        }
    }

    /**
     * Makes the next query fail with {@code failure} without evaluating it.
     */
    public synchronized void failNext(StoreException failure) {
        scheduledFailures.add(failure);
    }

    public synchronized List<JsonNode> getReceived() {
        return new ArrayList<>(received);
    }

    public synchronized boolean hasCollection(String name) {
        return collections.containsKey(name);
    }

    public synchronized boolean hasIndex(String name) {
        return indexes.containsKey(name);
    }

    public synchronized List<String> indexNames() {
        return new ArrayList<>(indexes.keySet());
    }

    /**
     * The data of every document in {@code collection}, in id order.
     */
    public synchronized List<Map<String, Object>> documents(String collection) {
        CollectionState state = collections.get(collection);
        if (state == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(state.documents.values());
    }

    /**
     * The {@code data} of the collection document itself.
     */
    public synchronized Map<String, Object> collectionData(String collection) {
        CollectionState state = collections.get(collection);
        return state == null ? null : state.data;
    }

    // ---- evaluation ----------------------------------------------------------------------

    private Object eval(JsonNode node, Env env) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonNode element : node) {
                values.add(eval(element, env));
            }
            return values;
        }
        if (node.size() == 1 && node.has("object")) {
            Map<String, Object> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("object").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                values.put(field.getKey(), eval(field.getValue(), env));
            }
            return values;
        }
        if (node.size() == 1 && node.has("var")) {
            return env.lookup(node.get("var").asText());
        }
        if (node.has("lambda")) {
            List<String> params = new ArrayList<>();
            if (node.get("lambda").isArray()) {
                node.get("lambda").forEach(param -> params.add(param.asText()));
            } else {
                params.add(node.get("lambda").asText());
            }
            return new Closure(params, node.get("expr"), env);
        }
        if (node.has("let")) {
            Env scope = env;
            for (JsonNode binding : node.get("let")) {
                Iterator<Map.Entry<String, JsonNode>> fields = binding.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    scope = scope.bind(field.getKey(), eval(field.getValue(), scope));
                }
            }
            return eval(node.get("in"), scope);
        }
        if (node.size() == 1 && (node.has("@ts") || node.has("@date"))) {
            String tag = node.has("@ts") ? "@ts" : "@date";
            return new Tagged(tag, node.get(tag).asText());
        }
        return call(formOf(node), node, env);
    }

    private static Form formOf(JsonNode node) {
        for (Form form : Form.values()) {
            if (!node.has(form.getName())) {
                continue;
            }
            boolean matches = true;
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                if (!form.getKeys().contains(names.next())) {
                    matches = false;
                }
            }
            if (matches) {
                return form;
            }
        }
        throw new StoreException("invalid expression", "No form/function found, or invalid argument keys: " + node);
    }

    @SuppressWarnings("unchecked")
    private Object call(Form form, JsonNode node, Env env) {
        switch (form) {
            case MATCH: {
                IndexState index = requireIndex(asRef(eval(node.get("match"), env), RefKind.INDEX));
                return node.has("terms")
                    ? matchIndex(index, true, eval(node.get("terms"), env))
                    : matchIndex(index, false, null);
            }
            case RANGE: {
                SetValue set = asSet(eval(node.get("range"), env));
                List<Object> from = asBound(eval(node.get("from"), env));
                List<Object> to = asBound(eval(node.get("to"), env));
                List<Object> entries = new ArrayList<>();
                for (Object entry : set.entries) {
                    List<Object> tuple = entry instanceof List ? (List<Object>) entry : Collections.singletonList(entry);
                    if (!from.isEmpty() && comparePrefix(tuple, from) < 0) {
                        continue;
                    }
                    if (!to.isEmpty() && comparePrefix(tuple, to) > 0) {
                        continue;
                    }
                    entries.add(entry);
                }
                return new SetValue(entries);
            }
            case JOIN: {
                SetValue source = asSet(eval(node.get("join"), env));
                Object with = eval(node.get("with"), env);
                List<Object> joined = new ArrayList<>();
                for (Object entry : source.entries) {
                    SetValue target;
                    if (with instanceof Closure) {
                        target = asSet(apply((Closure) with, entry));
                    } else {
                        target = matchIndex(requireIndex(asRef(with, RefKind.INDEX)), true, entry);
                    }
                    joined.addAll(target.entries);
                }
                return SetValue.sorted(joined);
            }
            case UNION: {
                List<Object> all = new ArrayList<>();
                for (Object set : asList(eval(node.get("union"), env))) {
                    all.addAll(asSet(set).entries);
                }
                return SetValue.sorted(all);
            }
            case INTERSECTION: {
                List<Object> sets = asList(eval(node.get("intersection"), env));
                TreeSet<Object> result = sortedSet(asSet(sets.get(0)).entries);
                for (Object other : sets.subList(1, sets.size())) {
                    result.retainAll(sortedSet(asSet(other).entries));
                }
                return new SetValue(new ArrayList<>(result));
            }
            case DIFFERENCE: {
                List<Object> sets = asList(eval(node.get("difference"), env));
                TreeSet<Object> result = sortedSet(asSet(sets.get(0)).entries);
                for (Object other : sets.subList(1, sets.size())) {
                    result.removeAll(sortedSet(asSet(other).entries));
                }
                return new SetValue(new ArrayList<>(result));
            }
            case SINGLETON:
                return new SetValue(Collections.singletonList(eval(node.get("singleton"), env)));
            case REVERSE: {
                Object source = eval(node.get("reverse"), env);
                List<Object> reversed = new ArrayList<>(source instanceof SetValue
                    ? ((SetValue) source).entries : asList(source));
                Collections.reverse(reversed);
                return source instanceof SetValue ? new SetValue(reversed) : reversed;
            }
            case PAGINATE: {
                SetValue set = asSet(eval(node.get("paginate"), env));
                long size = node.has("size") ? asLong(eval(node.get("size"), env)) : 64;
                Map<String, Object> page = new LinkedHashMap<>();
                page.put("data", new ArrayList<>(set.entries.subList(0, (int) Math.min(size, set.entries.size()))));
                return page;
            }
            case MAP: {
                Closure lambda = asClosure(eval(node.get("map"), env));
                List<Object> mapped = new ArrayList<>();
                for (Object element : asList(eval(node.get("collection"), env))) {
                    mapped.add(apply(lambda, element));
                }
                return mapped;
            }
            case FILTER: {
                Closure lambda = asClosure(eval(node.get("filter"), env));
                Object collection = eval(node.get("collection"), env);
                List<Object> source = collection instanceof SetValue ? ((SetValue) collection).entries : asList(collection);
                List<Object> kept = new ArrayList<>();
                for (Object element : source) {
                    if (asBoolean(apply(lambda, element))) {
                        kept.add(element);
                    }
                }
                return collection instanceof SetValue ? new SetValue(kept) : kept;
            }
            case FOREACH: {
                Closure lambda = asClosure(eval(node.get("foreach"), env));
                List<Object> collection = asList(eval(node.get("collection"), env));
                for (Object element : collection) {
                    apply(lambda, element);
                }
                return collection;
            }
            case REDUCE: {
                Closure lambda = asClosure(eval(node.get("reduce"), env));
                Object accumulator = eval(node.get("initial"), env);
                for (Object element : asList(eval(node.get("collection"), env))) {
                    accumulator = apply(lambda, Arrays.asList(accumulator, element));
                }
                return accumulator;
            }
            case APPEND: {
                List<Object> elements = asList(eval(node.get("append"), env));
                List<Object> result = new ArrayList<>(asList(eval(node.get("collection"), env)));
                result.addAll(elements);
                return result;
            }
            case TAKE: {
                long count = asLong(eval(node.get("take"), env));
                List<Object> collection = asList(eval(node.get("collection"), env));
                return new ArrayList<>(collection.subList(0, (int) Math.min(count, collection.size())));
            }
            case DISTINCT: {
                Object collection = eval(node.get("distinct"), env);
                if (collection instanceof SetValue) {
                    return collection;
                }
                List<Object> distinct = new ArrayList<>();
                TreeSet<Object> seen = new TreeSet<>(InMemoryFaunaStore::compareValues);
                for (Object element : asList(collection)) {
                    if (seen.add(element)) {
                        distinct.add(element);
                    }
                }
                return distinct;
            }
            case COUNT:
                return (long) elements(eval(node.get("count"), env)).size();
            case IS_EMPTY:
                return elements(eval(node.get("is_empty"), env)).isEmpty();
            case TO_ARRAY: {
                List<Object> pairs = new ArrayList<>();
                for (Map.Entry<String, Object> entry : asMap(eval(node.get("to_array"), env)).entrySet()) {
                    pairs.add(Arrays.asList(entry.getKey(), entry.getValue()));
                }
                return pairs;
            }
            case TO_OBJECT: {
                Map<String, Object> object = new LinkedHashMap<>();
                for (Object pair : asList(eval(node.get("to_object"), env))) {
                    List<Object> entry = asList(pair);
                    object.put(String.valueOf(entry.get(0)), entry.get(1));
                }
                return object;
            }
            case IF:
                return asBoolean(eval(node.get("if"), env))
                    ? eval(node.get("then"), env)
                    : eval(node.get("else"), env);
            case EQUALS: {
                List<Object> operands = asList(eval(node.get("equals"), env));
                for (Object operand : operands) {
                    if (compareValues(operands.get(0), operand) != 0) {
                        return false;
                    }
                }
                return true;
            }
            case OR: {
                for (Object operand : asList(eval(node.get("or"), env))) {
                    if (asBoolean(operand)) {
                        return true;
                    }
                }
                return false;
            }
            case AND: {
                for (Object operand : asList(eval(node.get("and"), env))) {
                    if (!asBoolean(operand)) {
                        return false;
                    }
                }
                return true;
            }
            case NOT:
                return !asBoolean(eval(node.get("not"), env));
            case IS_NULL:
                return eval(node.get("is_null"), env) == null;
            case DO: {
                List<Object> results = asList(eval(node.get("do"), env));
                return results.isEmpty() ? null : results.get(results.size() - 1);
            }
            case SELECT:
                return select(node, env);
            case MERGE: {
                Map<String, Object> merged = new LinkedHashMap<>(asMap(eval(node.get("merge"), env)));
                for (Map.Entry<String, Object> entry : asMap(eval(node.get("with"), env)).entrySet()) {
                    if (entry.getValue() == null) {
                        merged.remove(entry.getKey());
                    } else {
                        merged.put(entry.getKey(), entry.getValue());
                    }
                }
                return merged;
            }
            case EXISTS:
                return exists(asRef(eval(node.get("exists"), env), null));
            case GET:
                return get(asRef(eval(node.get("get"), env), null));
            case REF: {
                StoreRef collection = asRef(eval(node.get("ref"), env), RefKind.COLLECTION);
                Object id = eval(node.get("id"), env);
                if (id == null) {
                    throw new StoreException("invalid argument", "Ref id cannot be null.");
                }
                return new StoreRef(RefKind.DOCUMENT, collection.id, String.valueOf(id));
            }
            case COLLECTION:
                return new StoreRef(RefKind.COLLECTION, null, asString(eval(node.get("collection"), env)));
            case INDEX:
                return new StoreRef(RefKind.INDEX, null, asString(eval(node.get("index"), env)));
            case CREATE:
                return create(asRef(eval(node.get("create"), env), RefKind.COLLECTION),
                    asMap(eval(node.get("params"), env)));
            case UPDATE:
                return update(asRef(eval(node.get("update"), env), null), asMap(eval(node.get("params"), env)));
            case DELETE:
                return delete(asRef(eval(node.get("delete"), env), null));
            case CREATE_COLLECTION:
                return createCollection(asMap(eval(node.get("create_collection"), env)));
            case CREATE_INDEX:
                return createIndex(asMap(eval(node.get("create_index"), env)));
            default:
                throw new StoreException("invalid expression", "Unsupported function " + form.getName());
        }
    }

    private Object select(JsonNode node, Env env) {
        Object pathValue = eval(node.get("select"), env);
        List<Object> path = pathValue instanceof List ? asList(pathValue) : Collections.singletonList(pathValue);
        Object current = eval(node.get("from"), env);
        for (Object segment : path) {
            if (current instanceof Map && segment instanceof String) {
                current = ((Map<?, ?>) current).get(segment);
            } else if (current instanceof List && segment instanceof Long) {
                List<?> list = (List<?>) current;
                int position = ((Long) segment).intValue();
                current = position >= 0 && position < list.size() ? list.get(position) : null;
            } else {
                current = null;
            }
            if (current == null) {
                break;
            }
        }
        if (current != null) {
            return current;
        }
        if (node.has("default")) {
            return eval(node.get("default"), env);
        }
        throw new StoreException("value not found", "Value not found at path " + path + ".");
    }

    private Object apply(Closure closure, Object argument) {
        Env scope = closure.env;
        if (closure.params.size() == 1) {
            scope = scope.bind(closure.params.get(0), argument);
        } else {
            List<Object> arguments = asList(argument);
            if (arguments.size() < closure.params.size()) {
                throw new StoreException("invalid argument",
                    "Lambda expects " + closure.params.size() + " arguments, got " + arguments.size() + ".");
            }
            for (int i = 0; i < closure.params.size(); i++) {
                scope = scope.bind(closure.params.get(i), arguments.get(i));
            }
        }
        return eval(closure.body, scope);
    }

    // ---- sets and indexes ----------------------------------------------------------------

    private SetValue matchIndex(IndexState index, boolean hasTerms, Object terms) {
        List<Object> wanted = null;
        if (hasTerms && !index.terms.isEmpty()) {
            wanted = index.terms.size() == 1 ? Collections.singletonList(terms) : asList(terms);
            if (wanted.contains(null)) {
                return new SetValue(Collections.emptyList());
            }
        }
        CollectionState source = collections.get(index.source);
        List<Object> entries = new ArrayList<>();
        if (source == null) {
            return new SetValue(entries);
        }
        for (Map.Entry<String, Map<String, Object>> document : source.documents.entrySet()) {
            Map<String, Object> view = documentView(source.name, document.getKey(), document.getValue());
            if (!index.terms.isEmpty()) {
                List<Object> documentTerms = extractAll(view, index.terms);
                if (documentTerms.contains(null)) {
                    continue;
                }
                if (wanted != null && compareValues(documentTerms, wanted) != 0) {
                    continue;
                }
            }
            entries.add(entryOf(index, view));
        }
        return SetValue.sorted(entries);
    }

    private static Object entryOf(IndexState index, Map<String, Object> view) {
        if (index.values.isEmpty()) {
            return view.get("ref");
        }
        if (index.values.size() == 1) {
            return extract(view, index.values.get(0));
        }
        return extractAll(view, index.values);
    }

    private static List<Object> extractAll(Map<String, Object> view, List<List<Object>> paths) {
        List<Object> values = new ArrayList<>();
        for (List<Object> path : paths) {
            values.add(extract(view, path));
        }
        return values;
    }

    private static Object extract(Map<String, Object> view, List<Object> path) {
        Object current = view;
        for (Object segment : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }

    private static int comparePrefix(List<Object> tuple, List<Object> bound) {
        for (int i = 0; i < bound.size(); i++) {
            if (i >= tuple.size()) {
                return -1;
            }
            int compared = compareValues(tuple.get(i), bound.get(i));
            if (compared != 0) {
                return compared;
            }
        }
        return 0;
    }

    private static TreeSet<Object> sortedSet(List<Object> entries) {
        TreeSet<Object> set = new TreeSet<>(InMemoryFaunaStore::compareValues);
        set.addAll(entries);
        return set;
    }

    // ---- documents and schema ------------------------------------------------------------

    private boolean exists(StoreRef ref) {
        switch (ref.kind) {
            case DOCUMENT:
                return collections.containsKey(ref.collection)
                    && collections.get(ref.collection).documents.containsKey(ref.id);
            case COLLECTION:
                return collections.containsKey(ref.id);
            default:
                return indexes.containsKey(ref.id);
        }
    }

    private Map<String, Object> get(StoreRef ref) {
        switch (ref.kind) {
            case DOCUMENT: {
                CollectionState collection = requireCollection(ref.collection);
                Map<String, Object> data = collection.documents.get(ref.id);
                if (data == null) {
                    throw new StoreException("instance not found", "Document not found.");
                }
                return documentView(collection.name, ref.id, data);
            }
            case COLLECTION:
                return collectionView(requireCollection(ref.id));
            default:
                return indexView(requireIndex(ref));
        }
    }

    private Map<String, Object> create(StoreRef collectionRef, Map<String, Object> params) {
        CollectionState collection = requireCollection(collectionRef.id);
        Map<String, Object> data = stripNulls(optionalMap(params.get("data")));
        String id = String.valueOf(nextId++);
        checkUnique(collection, id, data);
        collection.documents.put(id, data);
        return documentView(collection.name, id, data);
    }

    private Map<String, Object> update(StoreRef ref, Map<String, Object> params) {
        Map<String, Object> patch = optionalMap(params.get("data"));
        if (ref.kind == RefKind.COLLECTION) {
            CollectionState collection = requireCollection(ref.id);
            collection.data = deepMerge(collection.data == null ? new LinkedHashMap<>() : collection.data, patch);
            return collectionView(collection);
        }
        if (ref.kind != RefKind.DOCUMENT) {
            throw new StoreException("invalid argument", "Cannot update " + ref + ".");
        }
        CollectionState collection = requireCollection(ref.collection);
        Map<String, Object> existing = collection.documents.get(ref.id);
        if (existing == null) {
            throw new StoreException("instance not found", "Document not found.");
        }
        Map<String, Object> data = deepMerge(existing, patch);
        checkUnique(collection, ref.id, data);
        collection.documents.put(ref.id, data);
        return documentView(collection.name, ref.id, data);
    }

    private Map<String, Object> delete(StoreRef ref) {
        Map<String, Object> deleted = get(ref);
        switch (ref.kind) {
            case DOCUMENT:
                collections.get(ref.collection).documents.remove(ref.id);
                break;
            case COLLECTION:
                collections.remove(ref.id);
                indexes.values().removeIf(index -> index.source.equals(ref.id));
                break;
            default:
                indexes.remove(ref.id);
        }
        return deleted;
    }

    private Map<String, Object> createCollection(Map<String, Object> params) {
        String name = asString(params.get("name"));
        if (collections.containsKey(name)) {
            throw new StoreException("instance already exists", "Collection already exists.");
        }
        Object data = params.get("data");
        CollectionState collection = new CollectionState(name,
            data == null ? null : stripNulls(asMap(data)), new TreeMap<>(ID_ORDER));
        collections.put(name, collection);
        return collectionView(collection);
    }

    private Map<String, Object> createIndex(Map<String, Object> params) {
        String name = asString(params.get("name"));
        if (indexes.containsKey(name)) {
            throw new StoreException("instance already exists", "Index already exists.");
        }
        StoreRef source = asRef(params.get("source"), RefKind.COLLECTION);
        requireCollection(source.id);
        IndexState index = new IndexState(name, source.id,
            fieldPaths(params.get("terms")), fieldPaths(params.get("values")),
            Boolean.TRUE.equals(params.get("unique")));
        indexes.put(name, index);
        return indexView(index);
    }

    private void checkUnique(CollectionState collection, String id, Map<String, Object> data) {
        Map<String, Object> candidate = documentView(collection.name, id, data);
        for (IndexState index : indexes.values()) {
            if (!index.unique || !index.source.equals(collection.name)) {
                continue;
            }
            List<Object> candidateTerms = extractAll(candidate, index.terms);
            if (candidateTerms.contains(null)) {
                continue;
            }
            for (Map.Entry<String, Map<String, Object>> other : collection.documents.entrySet()) {
                if (other.getKey().equals(id)) {
                    continue;
                }
                List<Object> otherTerms = extractAll(documentView(collection.name, other.getKey(), other.getValue()), index.terms);
                if (compareValues(candidateTerms, otherTerms) == 0) {
                    throw new StoreException("instance not unique", "document is not unique.");
                }
            }
        }
    }

    private CollectionState requireCollection(String name) {
        CollectionState collection = collections.get(name);
        if (collection == null) {
            throw new StoreException("invalid ref", "Ref refers to undefined collection '" + name + "'");
        }
        return collection;
    }

    private IndexState requireIndex(StoreRef ref) {
        IndexState index = indexes.get(ref.id);
        if (index == null) {
            throw new StoreException("invalid ref", "Ref refers to undefined index '" + ref.id + "'");
        }
        return index;
    }

    private Map<String, Object> documentView(String collection, String id, Map<String, Object> data) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ref", new StoreRef(RefKind.DOCUMENT, collection, id));
        view.put("ts", clock++);
        view.put("data", data);
        return view;
    }

    private static Map<String, Object> collectionView(CollectionState collection) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ref", new StoreRef(RefKind.COLLECTION, null, collection.name));
        view.put("name", collection.name);
        if (collection.data != null) {
            view.put("data", collection.data);
        }
        return view;
    }

    private static Map<String, Object> indexView(IndexState index) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ref", new StoreRef(RefKind.INDEX, null, index.name));
        view.put("name", index.name);
        view.put("source", new StoreRef(RefKind.COLLECTION, null, index.source));
        view.put("unique", index.unique);
        return view;
    }

    private static List<List<Object>> fieldPaths(Object fields) {
        List<List<Object>> paths = new ArrayList<>();
        if (fields == null) {
            return paths;
        }
        for (Object field : asList(fields)) {
            Object path = asMap(field).get("field");
            paths.add(path instanceof List ? asList(path) : Collections.singletonList(path));
        }
        return paths;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> patch) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            Object value = entry.getValue();
            Object existing = merged.get(entry.getKey());
            if (value == null) {
                merged.remove(entry.getKey());
            } else if (value instanceof Map && existing instanceof Map) {
                merged.put(entry.getKey(), deepMerge((Map<String, Object>) existing, (Map<String, Object>) value));
            } else {
                merged.put(entry.getKey(), stripNullsIn(value));
            }
        }
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> stripNulls(Map<String, Object> data) {
        Map<String, Object> stripped = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (entry.getValue() != null) {
                stripped.put(entry.getKey(), stripNullsIn(entry.getValue()));
            }
        }
        return stripped;
    }

    @SuppressWarnings("unchecked")
    private static Object stripNullsIn(Object value) {
        if (value instanceof Map) {
            return stripNulls((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> stripped = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                stripped.add(stripNullsIn(element));
            }
            return stripped;
        }
        return value;
    }

    // ---- value helpers -------------------------------------------------------------------

    private static List<Object> elements(Object value) {
        if (value instanceof SetValue) {
            return ((SetValue) value).entries;
        }
        if (value instanceof Map && ((Map<?, ?>) value).containsKey("data")) {
            return asList(((Map<?, ?>) value).get("data"));
        }
        return asList(value);
    }

    private static List<Object> asBound(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        return value instanceof List ? asList(value) : Collections.singletonList(value);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        if (!(value instanceof List)) {
            throw new StoreException("invalid argument", "Array expected, got " + describe(value) + ".");
        }
        return (List<Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map)) {
            throw new StoreException("invalid argument", "Object expected, got " + describe(value) + ".");
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> optionalMap(Object value) {
        return value == null ? new LinkedHashMap<>() : asMap(value);
    }

    private static SetValue asSet(Object value) {
        if (!(value instanceof SetValue)) {
            throw new StoreException("invalid argument", "Set expected, got " + describe(value) + ".");
        }
        return (SetValue) value;
    }

    private static Closure asClosure(Object value) {
        if (!(value instanceof Closure)) {
            throw new StoreException("invalid argument", "Lambda expected, got " + describe(value) + ".");
        }
        return (Closure) value;
    }

    private static boolean asBoolean(Object value) {
        if (!(value instanceof Boolean)) {
            throw new StoreException("invalid argument", "Boolean expected, got " + describe(value) + ".");
        }
        return (Boolean) value;
    }

    private static long asLong(Object value) {
        if (!(value instanceof Long)) {
            throw new StoreException("invalid argument", "Integer expected, got " + describe(value) + ".");
        }
        return (Long) value;
    }

    private static String asString(Object value) {
        if (!(value instanceof String)) {
            throw new StoreException("invalid argument", "String expected, got " + describe(value) + ".");
        }
        return (String) value;
    }

    private static StoreRef asRef(Object value, RefKind kind) {
        if (!(value instanceof StoreRef) || (kind != null && ((StoreRef) value).kind != kind)) {
            throw new StoreException("invalid argument",
                (kind == null ? "Ref" : kind + " ref") + " expected, got " + describe(value) + ".");
        }
        return (StoreRef) value;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }

    /**
     * Total order over stored values: null, numbers, strings, times, booleans, refs, arrays,
     * objects.
     */
    @SuppressWarnings("unchecked")
    static int compareValues(Object left, Object right) {
        int rank = Integer.compare(rank(left), rank(right));
        if (rank != 0) {
            return rank;
        }
        if (left == null) {
            return 0;
        }
        if (left instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof Tagged) {
            return ((Tagged) left).text.compareTo(((Tagged) right).text);
        }
        if (left instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        if (left instanceof StoreRef) {
            return ((StoreRef) left).compareTo((StoreRef) right);
        }
        if (left instanceof List) {
            List<Object> a = (List<Object>) left;
            List<Object> b = (List<Object>) right;
            for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
                int compared = compareValues(a.get(i), b.get(i));
                if (compared != 0) {
                    return compared;
                }
            }
            return Integer.compare(a.size(), b.size());
        }
        if (left instanceof Map) {
            List<Object> a = new ArrayList<>();
            ((Map<String, Object>) left).forEach((key, value) -> a.add(Arrays.asList(key, value)));
            List<Object> b = new ArrayList<>();
            ((Map<String, Object>) right).forEach((key, value) -> b.add(Arrays.asList(key, value)));
            return compareValues(a, b);
        }
        return Integer.compare(System.identityHashCode(left), System.identityHashCode(right));
    }

    private static int rank(Object value) {
        if (value == null) return 0;
        if (value instanceof Number) return 1;
        if (value instanceof String) return 2;
        if (value instanceof Tagged) return 3;
        if (value instanceof Boolean) return 4;
        if (value instanceof StoreRef) return 5;
        if (value instanceof List) return 6;
        if (value instanceof Map) return 7;
        return 8;
    }

    // ---- encoding ------------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private static JsonNode encode(Object value) {
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof Boolean) {
            return nodes.booleanNode((Boolean) value);
        }
        if (value instanceof Long) {
            return nodes.numberNode((Long) value);
        }
        if (value instanceof Double) {
            return nodes.numberNode((Double) value);
        }
        if (value instanceof String) {
            return nodes.textNode((String) value);
        }
        if (value instanceof Tagged) {
            ObjectNode node = nodes.objectNode();
            node.put(((Tagged) value).tag, ((Tagged) value).text);
            return node;
        }
        if (value instanceof StoreRef) {
            return ((StoreRef) value).toJson();
        }
        if (value instanceof List) {
            ArrayNode array = nodes.arrayNode();
            for (Object element : (List<Object>) value) {
                array.add(encode(element));
            }
            return array;
        }
        if (value instanceof SetValue) {
            ObjectNode node = nodes.objectNode();
            node.set("@set", encode(((SetValue) value).entries));
            return node;
        }
        if (value instanceof Map) {
            ObjectNode object = nodes.objectNode();
            boolean reserved = false;
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                object.set(entry.getKey(), encode(entry.getValue()));
                reserved |= entry.getKey().startsWith("@");
            }
            if (reserved) {
                ObjectNode wrapper = nodes.objectNode();
                wrapper.set("@obj", object);
                return wrapper;
            }
            return object;
        }
        throw new StoreException("invalid expression", "Cannot return " + describe(value) + ".");
    }

    // ---- state ---------------------------------------------------------------------------

    private enum RefKind {
        DOCUMENT, COLLECTION, INDEX
    }

    private static final class StoreRef implements Comparable<StoreRef> {
        private final RefKind kind;
        private final String collection;
        private final String id;

        private StoreRef(RefKind kind, String collection, String id) {
            this.kind = kind;
            this.collection = collection;
            this.id = id;
        }

        @Override
        public int compareTo(StoreRef other) {
            int compared = kind.compareTo(other.kind);
            if (compared == 0) {
                compared = String.valueOf(collection).compareTo(String.valueOf(other.collection));
            }
            return compared != 0 ? compared : ID_ORDER.compare(id, other.id);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StoreRef && compareTo((StoreRef) o) == 0;
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(new Object[] {kind, collection, id});
        }

        private JsonNode toJson() {
            ObjectNode ref = nodes.objectNode();
            ref.put("id", id);
            switch (kind) {
                case DOCUMENT:
                    ref.set("collection", new StoreRef(RefKind.COLLECTION, null, collection).toJson());
                    break;
                case COLLECTION:
                    ref.set("collection", schemaRef("collections"));
                    break;
                default:
                    ref.set("collection", schemaRef("indexes"));
            }
            ObjectNode node = nodes.objectNode();
            node.set("@ref", ref);
            return node;
        }

        private static JsonNode schemaRef(String id) {
            ObjectNode ref = nodes.objectNode();
            ref.put("id", id);
            ObjectNode node = nodes.objectNode();
            node.set("@ref", ref);
            return node;
        }

        @Override
        public String toString() {
            return kind == RefKind.DOCUMENT ? "Ref(" + collection + ", " + id + ")" : kind + "(" + id + ")";
        }
    }

    private static final class SetValue {
        private final List<Object> entries;

        private SetValue(List<Object> entries) {
            this.entries = entries;
        }

        private static SetValue sorted(List<Object> entries) {
            return new SetValue(new ArrayList<>(sortedSet(entries)));
        }

        @Override
        public String toString() {
            return "Set" + entries;
        }
    }

    private static final class Tagged {
        private final String tag;
        private final String text;

        private Tagged(String tag, String text) {
            this.tag = tag;
            this.text = text;
        }

        @Override
        public String toString() {
            return tag + ":" + text;
        }
    }

    private static final class Closure {
        private final List<String> params;
        private final JsonNode body;
        private final Env env;

        private Closure(List<String> params, JsonNode body, Env env) {
            this.params = params;
            this.body = body;
            this.env = env;
        }
    }

    private static final class Env {
        private static final Env EMPTY = new Env(null, null, null);

        private final String name;
        private final Object value;
        private final Env parent;

        private Env(String name, Object value, Env parent) {
            this.name = name;
            this.value = value;
            this.parent = parent;
        }

        private Env bind(String name, Object value) {
            return new Env(name, value, this);
        }

        private Object lookup(String variable) {
            for (Env scope = this; scope != null && scope.name != null; scope = scope.parent) {
                if (scope.name.equals(variable)) {
                    return scope.value;
                }
            }
            throw new StoreException("invalid expression", "Variable '" + variable + "' is not defined.");
        }
    }

    private static final class CollectionState {
        private final String name;
        private Map<String, Object> data;
        private final TreeMap<String, Map<String, Object>> documents;

        private CollectionState(String name, Map<String, Object> data, TreeMap<String, Map<String, Object>> documents) {
            this.name = name;
            this.data = data;
            this.documents = documents;
        }

        private CollectionState copy() {
            return new CollectionState(name, data, new TreeMap<>(documents));
        }
    }

    private static final class IndexState {
        private final String name;
        private final String source;
        private final List<List<Object>> terms;
        private final List<List<Object>> values;
        private final boolean unique;

        private IndexState(String name, String source, List<List<Object>> terms,
                           List<List<Object>> values, boolean unique) {
            this.name = name;
            this.source = source;
            this.terms = terms;
            this.values = values;
            this.unique = unique;
        }
    }
}

package com.dcruver.marginnote.plist;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an NSKeyedArchiver property list into plain Java values.
 *
 * <p>Resolution follows UID references from {@code $top.root} through the {@code $objects}
 * table. Simplification then collapses Foundation containers: array and set classes become
 * {@code List}s of their {@code NS.objects}, dictionary classes become {@code Map}s zipped from
 * {@code NS.keys} and {@code NS.objects}, and any other object becomes a map of its fields
 * without {@code $}-prefixed keys, or {@code null} when nothing is left.
 */
@Slf4j
public class KeyedArchiverResolver {

    static final String NULL_SENTINEL = "$null";
    private static final List<String> REQUIRED_KEYS = List.of("$archiver", "$version", "$objects", "$top");
    private static final Set<String> ARRAY_CLASSES = Set.of(
        "NSArray", "NSMutableArray", "NSSet", "NSMutableSet", "NSOrderedSet", "NSMutableOrderedSet");
    private static final Set<String> DICTIONARY_CLASSES = Set.of("NSDictionary", "NSMutableDictionary");

    private final int maxDepth;

    public KeyedArchiverResolver(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Validate the archiver envelope. Empty when the root is not a keyed archive.
     */
    public Optional<ArchiveObjectGraph> toObjectGraph(PlistValue root) throws PlistDecodeException {
        if (!(root instanceof PlistValue.Dict)) {
            return Optional.empty();
        }
        PlistValue.Dict envelope = (PlistValue.Dict) root;
        for (String key : REQUIRED_KEYS) {
            if (!envelope.containsKey(key)) {
                return Optional.empty();
            }
        }
        if (!(envelope.get("$objects") instanceof PlistValue.Array)
            || !(envelope.get("$top") instanceof PlistValue.Dict)) {
            return Optional.empty();
        }

        List<PlistValue> objects = ((PlistValue.Array) envelope.get("$objects")).items();
        PlistValue rootRef = ((PlistValue.Dict) envelope.get("$top")).get("root");
        if (!(rootRef instanceof PlistValue.Uid)) {
            return Optional.empty();
        }
        int rootUid = ((PlistValue.Uid) rootRef).index();
        if (rootUid >= objects.size()) {
            throw new PlistDecodeException("Root UID " + rootUid + " outside object table of " + objects.size());
        }
        return Optional.of(new ArchiveObjectGraph(objects, rootUid));
    }

    /**
     * Resolve the graph from its root and simplify the result.
     */
    public Object decode(ArchiveObjectGraph graph) throws PlistDecodeException {
        return simplify(resolve(graph));
    }

    /**
     * Substitute every UID reference reachable from the root with the object it names.
     * Maps keep the archive's field names, including {@code $class}. Depth is the number
     * of UID hops from the root.
     */
    public Object resolve(ArchiveObjectGraph graph) throws PlistDecodeException {
        return new Resolution(graph).resolveUid(graph.rootUid(), 0);
    }

    private final class Resolution {
        private final ArchiveObjectGraph graph;
        private final Map<Integer, Object> resolved = new LinkedHashMap<>();
        private final Set<Integer> ancestors = new HashSet<>();

        Resolution(ArchiveObjectGraph graph) {
            this.graph = graph;
        }

        Object resolveUid(int index, int depth) throws PlistDecodeException {
            if (index < 0 || index >= graph.size()) {
                throw new PlistDecodeException("UID " + index + " outside object table of " + graph.size());
            }
            if (resolved.containsKey(index)) {
                return resolved.get(index);
            }
            if (!ancestors.add(index)) {
                throw new PlistDecodeException("Cyclic UID reference to object " + index);
            }
            if (depth > maxDepth) {
                throw new PlistDecodeException("Object graph deeper than " + maxDepth);
            }
            Object value = resolveValue(graph.objects().get(index), depth);
            ancestors.remove(index);
            resolved.put(index, value);
            return value;
        }

        // inline containers stay at their object's depth; only a UID reference goes one deeper
        Object resolveValue(PlistValue value, int depth) throws PlistDecodeException {
            if (value instanceof PlistValue.Uid) {
                return resolveUid(((PlistValue.Uid) value).index(), depth + 1);
            }
            if (value instanceof PlistValue.Text) {
                String text = ((PlistValue.Text) value).value();
                return NULL_SENTINEL.equals(text) ? null : text;
            }
            if (value instanceof PlistValue.Array) {
                List<Object> items = new ArrayList<>();
                for (PlistValue item : ((PlistValue.Array) value).items()) {
                    items.add(resolveValue(item, depth));
                }
                return items;
            }
            if (value instanceof PlistValue.Dict) {
                Map<String, Object> fields = new LinkedHashMap<>();
                for (Map.Entry<PlistValue, PlistValue> entry : ((PlistValue.Dict) value).entries().entrySet()) {
                    Object key = resolveValue(entry.getKey(), depth);
                    fields.put(String.valueOf(key), resolveValue(entry.getValue(), depth));
                }
                return fields;
            }
            return scalar(value);
        }
    }

    /**
     * Collapse Foundation container encodings in a resolved tree.
     */
    public Object simplify(Object resolved) {
        return simplify(resolved, new IdentityHashMap<>());
    }

    @SuppressWarnings("unchecked")
    private Object simplify(Object value, Map<Object, Object> done) {
        if (!(value instanceof Map) && !(value instanceof List)) {
            return value;
        }
        if (done.containsKey(value)) {
            return done.get(value);
        }

        Object result;
        if (value instanceof List) {
            result = simplifyList((List<Object>) value, done);
        } else {
            Map<String, Object> fields = (Map<String, Object>) value;
            String className = className(fields.get("$class"));
            if (className != null && ARRAY_CLASSES.contains(className)) {
                result = simplifyList(asList(fields.get("NS.objects")), done);
            } else if (className != null && DICTIONARY_CLASSES.contains(className)) {
                result = simplifyDictionary(asList(fields.get("NS.keys")), asList(fields.get("NS.objects")), done);
            } else {
                Map<String, Object> plain = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : fields.entrySet()) {
                    if (entry.getKey().startsWith("$")) {
                        continue;
                    }
                    Object simplified = simplify(entry.getValue(), done);
                    if (simplified != null) {
                        plain.put(entry.getKey(), simplified);
                    }
                }
                result = plain.isEmpty() ? null : plain;
            }
        }
        done.put(value, result);
        return result;
    }

    private List<Object> simplifyList(List<Object> items, Map<Object, Object> done) {
        List<Object> out = new ArrayList<>();
        for (Object item : items) {
            Object simplified = simplify(item, done);
            if (simplified != null) {
                out.add(simplified);
            }
        }
        return out;
    }

    private Map<String, Object> simplifyDictionary(List<Object> keys, List<Object> values, Map<Object, Object> done) {
        Map<String, Object> out = new LinkedHashMap<>();
        int count = Math.min(keys.size(), values.size());
        if (keys.size() != values.size()) {
            log.debug("Dictionary has {} keys and {} values, pairing the first {}", keys.size(), values.size(), count);
        }
        for (int i = 0; i < count; i++) {
            Object key = simplify(keys.get(i), done);
            Object item = simplify(values.get(i), done);
            if (key != null && item != null) {
                out.put(String.valueOf(key), item);
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return value instanceof List ? (List<Object>) value : List.of();
    }

    @SuppressWarnings("unchecked")
    private static String className(Object classInfo) {
        if (classInfo instanceof Map) {
            Object name = ((Map<String, Object>) classInfo).get("$classname");
            return name instanceof String ? (String) name : null;
        }
        return null;
    }

    private static Object scalar(PlistValue value) {
        if (value instanceof PlistValue.Int) {
            return ((PlistValue.Int) value).value();
        }
        if (value instanceof PlistValue.Real) {
            return ((PlistValue.Real) value).value();
        }
        if (value instanceof PlistValue.Bool) {
            return ((PlistValue.Bool) value).value();
        }
        if (value instanceof PlistValue.Date) {
            return ((PlistValue.Date) value).value();
        }
        if (value instanceof PlistValue.Data) {
            return ((PlistValue.Data) value).bytes();
        }
        return null;
    }
}

package com.dcruver.marginnote.plist;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dcruver.marginnote.plist.BinaryPlistWriter.archive;
import static com.dcruver.marginnote.plist.BinaryPlistWriter.array;
import static com.dcruver.marginnote.plist.BinaryPlistWriter.classInfo;
import static com.dcruver.marginnote.plist.BinaryPlistWriter.dict;
import static com.dcruver.marginnote.plist.BinaryPlistWriter.text;
import static com.dcruver.marginnote.plist.BinaryPlistWriter.uid;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyedArchiverResolverTest {

    private KeyedArchiverResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new KeyedArchiverResolver(256);
    }

    private Object decode(PlistValue root) throws PlistDecodeException {
        Optional<ArchiveObjectGraph> graph = resolver.toObjectGraph(root);
        assertTrue(graph.isPresent(), "expected a keyed archive");
        return resolver.decode(graph.get());
    }

    @Test
    void testNonArchiveHasNoObjectGraph() throws Exception {
        assertTrue(resolver.toObjectGraph(dict("a", 1)).isEmpty());
        assertTrue(resolver.toObjectGraph(array("x")).isEmpty());
        assertTrue(resolver.toObjectGraph(dict(
            "$archiver", "NSKeyedArchiver", "$version", 100000, "$objects", "oops", "$top", dict())).isEmpty());
    }

    @Test
    void testRootOutsideObjectTableIsRejected() {
        PlistValue root = archive(List.of(text("$null")), 9);

        assertThrows(PlistDecodeException.class, () -> resolver.toObjectGraph(root));
    }

    @Test
    void testArrayClassCollapsesToList() throws Exception {
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("$class", uid(4), "NS.objects", array(uid(2), uid(3), uid(0))),
            text("first"),
            text("second"),
            classInfo("NSMutableArray"));

        assertEquals(List.of("first", "second"), decode(archive(objects, 1)));
    }

    @Test
    void testDictionaryClassZipsKeysAndObjects() throws Exception {
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("$class", uid(6), "NS.keys", array(uid(2), uid(3)), "NS.objects", array(uid(4), uid(5))),
            text("noteid"),
            text("text"),
            text("N-1"),
            text("hello"),
            classInfo("NSDictionary"));

        assertEquals(Map.of("noteid", "N-1", "text", "hello"), decode(archive(objects, 1)));
    }

    @Test
    void testPlainObjectDropsDollarKeysAndNulls() throws Exception {
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("$class", uid(3), "noteid", uid(2), "paint", uid(0), "pageNo", 4),
            text("N-7"),
            classInfo("MbBookNote"));

        @SuppressWarnings("unchecked")
        Map<String, Object> note = (Map<String, Object>) decode(archive(objects, 1));

        assertEquals(Map.of("noteid", "N-7", "pageNo", 4L), note);
    }

    @Test
    void testObjectWithOnlyClassBecomesNull() throws Exception {
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("$class", uid(2)),
            classInfo("MbEmpty"));

        assertNull(decode(archive(objects, 1)));
    }

    @Test
    void testNestedCollectionsInsideArray() throws Exception {
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("$class", uid(4), "NS.objects", array(uid(2), uid(3))),
            dict("$class", uid(5), "noteid", uid(6), "type", uid(7)),
            dict("$class", uid(5), "text", uid(8)),
            classInfo("NSArray"),
            classInfo("MbLink"),
            text("N-2"),
            text("LinkNote"),
            text("comment"));

        Object decoded = decode(archive(objects, 1));

        assertEquals(List.of(Map.of("noteid", "N-2", "type", "LinkNote"), Map.of("text", "comment")), decoded);
    }

    @Test
    void testSharedReferenceIsNotACycle() throws Exception {
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("left", uid(2), "right", uid(2)),
            dict("value", 1));

        Object resolved = resolver.resolve(resolver.toObjectGraph(archive(objects, 1)).orElseThrow());

        Map<?, ?> root = (Map<?, ?>) resolved;
        assertSame(root.get("left"), root.get("right"));
    }

    @Test
    void testCyclicReferenceIsRejected() {
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("child", uid(2)),
            dict("parent", uid(1)));

        PlistDecodeException e = assertThrows(PlistDecodeException.class, () -> decode(archive(objects, 1)));
        assertTrue(e.getMessage().contains("Cyclic"));
    }

    @Test
    void testDepthLimit() {
        List<PlistValue> objects = new ArrayList<>();
        objects.add(text("$null"));
        for (int i = 1; i < 40; i++) {
            objects.add(dict("next", uid(i + 1)));
        }
        objects.add(text("bottom"));
        KeyedArchiverResolver shallow = new KeyedArchiverResolver(16);

        PlistDecodeException e = assertThrows(PlistDecodeException.class,
            () -> shallow.decode(shallow.toObjectGraph(archive(objects, 1)).orElseThrow()));
        assertTrue(e.getMessage().contains("deeper than 16"));
    }

    @Test
    void testBlobDecoderStatuses() throws Exception {
        ArchivedBlobDecoder decoder = new ArchivedBlobDecoder(new BinaryPlistParser(), resolver, false);
        List<PlistValue> objects = List.of(
            text("$null"),
            dict("$class", uid(3), "text", uid(2)),
            text("hello"),
            classInfo("MbComment"));

        assertEquals(DecodedBlob.Status.EMPTY, decoder.decode(null).status());
        assertEquals(DecodedBlob.Status.EMPTY, decoder.decode(new byte[0]).status());
        assertEquals(DecodedBlob.Status.NOT_ARCHIVED, decoder.decode(BinaryPlistWriter.write(dict("a", 1))).status());
        assertEquals(DecodedBlob.Status.FAILED, decoder.decode("garbage".getBytes()).status());

        DecodedBlob decoded = decoder.decode(BinaryPlistWriter.write(archive(objects, 1)));
        assertEquals(DecodedBlob.Status.DECODED, decoded.status());
        assertEquals(List.of(Map.of("text", "hello")), decoded.entries());

        byte[] truncated = {'b', 'p', 'l', 'i', 's', 't', '0', '0', 0x54, '#', 't', 'a', 'g'};
        DecodedBlob degraded = decoder.decode(truncated);
        assertEquals(DecodedBlob.Status.DEGRADED, degraded.status());
        assertEquals(List.of("#tag"), degraded.recoveredStrings());
    }

    @Test
    void testOverflowingDateFailsOnlyThatBlob() throws Exception {
        ArchivedBlobDecoder lenient = new ArchivedBlobDecoder(new BinaryPlistParser(), resolver, false);
        ArchivedBlobDecoder strict = new ArchivedBlobDecoder(new BinaryPlistParser(), resolver, true);
        byte[] blob = BinaryPlistWriter.assemble(List.of(BinaryPlistParserTest.dateObject(1e300)), 0);

        assertEquals(DecodedBlob.Status.FAILED, lenient.decode(blob).status());
        assertThrows(PlistDecodeException.class, () -> strict.decode(blob));
    }

    @Test
    void testDepthCountsUidHops() throws Exception {
        List<PlistValue> objects = new ArrayList<>();
        objects.add(text("$null"));
        for (int i = 1; i <= 10; i++) {
            objects.add(dict("next", uid(i + 1), "items", array(1, 2, array(3))));
        }
        objects.add(text("bottom"));
        PlistValue root = archive(objects, 1);

        KeyedArchiverResolver exact = new KeyedArchiverResolver(10);
        assertTrue(exact.resolve(exact.toObjectGraph(root).orElseThrow()) instanceof Map);

        KeyedArchiverResolver oneShort = new KeyedArchiverResolver(9);
        assertThrows(PlistDecodeException.class,
            () -> oneShort.resolve(oneShort.toObjectGraph(root).orElseThrow()));
    }

    @Test
    void testStrictDecoderRethrows() {
        ArchivedBlobDecoder decoder = new ArchivedBlobDecoder(new BinaryPlistParser(), resolver, true);
        byte[] cyclic = BinaryPlistWriter.write(archive(List.of(
            text("$null"),
            dict("child", uid(2)),
            dict("parent", uid(1))), 1));

        assertThrows(PlistDecodeException.class, () -> decoder.decode(cyclic));
        assertThrows(PlistDecodeException.class, () -> decoder.decode("garbage".getBytes()));
    }
}

package com.dcruver.marginnote.plist;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static com.dcruver.marginnote.plist.BinaryPlistWriter.array;
import static com.dcruver.marginnote.plist.BinaryPlistWriter.dict;
import static com.dcruver.marginnote.plist.BinaryPlistWriter.text;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BinaryPlistParserTest {

    private BinaryPlistParser parser;

    @BeforeEach
    void setUp() {
        parser = new BinaryPlistParser();
    }

    @Test
    void testScalarTypes() throws Exception {
        Instant when = Instant.ofEpochSecond(BinaryPlistParser.APPLE_EPOCH_OFFSET + 700_000_000L);
        PlistValue root = dict(
            "small", 7,
            "wide", 70_000,
            "huge", 5_000_000_000L,
            "ratio", 0.25,
            "yes", true,
            "no", false,
            "blob", new byte[]{1, 2, 3},
            "when", new PlistValue.Date(when),
            "nothing", null);

        ParsedPlist parsed = parser.parse(BinaryPlistWriter.write(root));

        assertFalse(parsed.degraded());
        PlistValue.Dict dict = assertInstanceOf(PlistValue.Dict.class, parsed.root());
        assertEquals(new PlistValue.Int(7), dict.get("small"));
        assertEquals(new PlistValue.Int(70_000), dict.get("wide"));
        assertEquals(new PlistValue.Int(5_000_000_000L), dict.get("huge"));
        assertEquals(new PlistValue.Real(0.25), dict.get("ratio"));
        assertEquals(new PlistValue.Bool(true), dict.get("yes"));
        assertEquals(new PlistValue.Bool(false), dict.get("no"));
        assertArrayEquals(new byte[]{1, 2, 3}, ((PlistValue.Data) dict.get("blob")).bytes());
        assertEquals(new PlistValue.Date(when), dict.get("when"));
        assertEquals(PlistValue.Null.INSTANCE, dict.get("nothing"));
    }

    @Test
    void testDateUsesAppleEpoch() throws Exception {
        PlistValue root = new PlistValue.Date(Instant.ofEpochSecond(BinaryPlistParser.APPLE_EPOCH_OFFSET));

        ParsedPlist parsed = parser.parse(BinaryPlistWriter.write(root));

        assertEquals(Instant.parse("2001-01-01T00:00:00Z"), ((PlistValue.Date) parsed.root()).value());
    }

    static byte[] dateObject(double appleSeconds) {
        byte[] object = new byte[9];
        object[0] = 0x33;
        long bits = Double.doubleToLongBits(appleSeconds);
        for (int i = 0; i < 8; i++) {
            object[1 + i] = (byte) (bits >>> (56 - 8 * i));
        }
        return object;
    }

    @Test
    void testOutOfRangeDatesAreRejected() {
        for (double seconds : new double[]{1e300, -1e300, Double.POSITIVE_INFINITY, Double.NaN}) {
            byte[] data = BinaryPlistWriter.assemble(List.of(dateObject(seconds)), 0);

            assertThrows(PlistDecodeException.class, () -> parser.parse(data), "date " + seconds);
        }
    }

    @Test
    void testUtf16AndAsciiText() throws Exception {
        PlistValue root = array("plain", "学习笔记", "Ünïcode");

        ParsedPlist parsed = parser.parse(BinaryPlistWriter.write(root));

        assertEquals(List.of(text("plain"), text("学习笔记"), text("Ünïcode")),
            ((PlistValue.Array) parsed.root()).items());
    }

    @Test
    void testExtendedCountsForLongValues() throws Exception {
        String longText = "a".repeat(300);
        Object[] items = new Object[20];
        for (int i = 0; i < items.length; i++) {
            items[i] = i;
        }
        PlistValue root = dict("text", longText, "items", array(items));

        PlistValue.Dict dict = (PlistValue.Dict) parser.parse(BinaryPlistWriter.write(root)).root();

        assertEquals(text(longText), dict.get("text"));
        List<PlistValue> parsedItems = ((PlistValue.Array) dict.get("items")).items();
        assertEquals(20, parsedItems.size());
        assertEquals(new PlistValue.Int(19), parsedItems.get(19));
    }

    @Test
    void testUidValues() throws Exception {
        PlistValue root = array(BinaryPlistWriter.uid(3), BinaryPlistWriter.uid(300));

        List<PlistValue> items = ((PlistValue.Array) parser.parse(BinaryPlistWriter.write(root)).root()).items();

        assertEquals(List.of(new PlistValue.Uid(3), new PlistValue.Uid(300)), items);
    }

    @Test
    void testParsingIsRepeatable() throws Exception {
        byte[] data = BinaryPlistWriter.write(dict("a", array(1, 2, "three"), "b", dict("c", 4.5)));

        assertEquals(parser.parse(data), parser.parse(data));
    }

    @Test
    void testMissingHeaderIsRejected() {
        byte[] data = "not a plist at all".getBytes(StandardCharsets.US_ASCII);

        assertThrows(PlistDecodeException.class, () -> parser.parse(data));
    }

    @Test
    void testSelfContainingArrayIsRejected() {
        byte[] selfRef = {(byte) 0xA1, 0x00, 0x00};
        byte[] data = BinaryPlistWriter.assemble(List.of(selfRef), 0);

        PlistDecodeException e = assertThrows(PlistDecodeException.class, () -> parser.parse(data));
        assertTrue(e.getMessage().contains("contains itself"));
    }

    @Test
    void testOutOfRangeReferenceIsRejected() {
        byte[] danglingRef = {(byte) 0xA1, 0x00, 0x05};
        byte[] data = BinaryPlistWriter.assemble(List.of(danglingRef), 0);

        assertThrows(PlistDecodeException.class, () -> parser.parse(data));
    }

    @Test
    void testTruncatedTrailerFallsBackToLinearScan() throws Exception {
        byte[] data = {
            'b', 'p', 'l', 'i', 's', 't', '0', '0',
            0x55, 'H', 'e', 'l', 'l', 'o',
            0x10, 0x2A,
            0x53, '#', 'm', 'n'
        };

        ParsedPlist parsed = parser.parse(data);

        assertTrue(parsed.degraded());
        assertEquals(List.of("Hello", "#mn"), parsed.recoveredStrings());
        assertTrue(parsed.recovered().contains(new PlistValue.Int(42)));
    }

    @Test
    void testNothingRecoverableIsRejected() {
        byte[] data = {'b', 'p', 'l', 'i', 's', 't', '0', '0', 0x00, 0x00, 0x00};

        assertThrows(PlistDecodeException.class, () -> parser.parse(data));
    }
}

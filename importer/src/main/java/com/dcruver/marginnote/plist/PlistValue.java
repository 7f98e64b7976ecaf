package com.dcruver.marginnote.plist;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A value decoded from a binary property list.
 * {@link Uid} values only mean something relative to the object table they came from.
 */
public interface PlistValue {

    record Null() implements PlistValue {
        public static final Null INSTANCE = new Null();
    }

    record Bool(boolean value) implements PlistValue {
    }

    record Int(long value) implements PlistValue {
    }

    record Real(double value) implements PlistValue {
    }

    record Date(Instant value) implements PlistValue {
    }

    record Data(byte[] bytes) implements PlistValue {
        @Override
        public boolean equals(Object o) {
            return o instanceof Data && Arrays.equals(bytes, ((Data) o).bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Data[" + bytes.length + " bytes]";
        }
    }

    /** Text, whether stored as ASCII or UTF-16 */
    record Text(String value) implements PlistValue {
    }

    record Uid(int index) implements PlistValue {
    }

    record Array(List<PlistValue> items) implements PlistValue {
    }

    /** Dictionary with keys in stream order */
    record Dict(Map<PlistValue, PlistValue> entries) implements PlistValue {

        public PlistValue get(String key) {
            return entries.get(new Text(key));
        }

        public boolean containsKey(String key) {
            return entries.containsKey(new Text(key));
        }
    }
}

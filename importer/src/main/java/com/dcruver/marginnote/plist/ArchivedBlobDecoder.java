package com.dcruver.marginnote.plist;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Parses and resolves one archived blob. In lenient mode a malformed blob yields a
 * FAILED result; in strict mode the decode error is rethrown.
 */
@Slf4j
public class ArchivedBlobDecoder {

    private final BinaryPlistParser parser;
    private final KeyedArchiverResolver resolver;
    private final boolean strict;

    public ArchivedBlobDecoder(BinaryPlistParser parser, KeyedArchiverResolver resolver, boolean strict) {
        this.parser = parser;
        this.resolver = resolver;
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Decode a blob column. Only throws in strict mode.
     */
    public DecodedBlob decode(byte[] blob) throws PlistDecodeException {
        if (blob == null || blob.length == 0) {
            return DecodedBlob.empty();
        }
        try {
            ParsedPlist parsed = parser.parse(blob);
            if (parsed.degraded()) {
                log.debug("Blob of {} bytes decoded in degraded mode, {} strings recovered",
                    blob.length, parsed.recoveredStrings().size());
                return new DecodedBlob(DecodedBlob.Status.DEGRADED, null, parsed.recoveredStrings());
            }

            Optional<ArchiveObjectGraph> graph = resolver.toObjectGraph(parsed.root());
            if (graph.isEmpty()) {
                return DecodedBlob.of(DecodedBlob.Status.NOT_ARCHIVED);
            }
            return new DecodedBlob(DecodedBlob.Status.DECODED, resolver.decode(graph.get()), List.of());
        } catch (PlistDecodeException e) {
            if (strict) {
                throw e;
            }
            log.warn("Could not decode archived blob of {} bytes: {}", blob.length, e.getMessage());
            return DecodedBlob.of(DecodedBlob.Status.FAILED);
        }
    }
}

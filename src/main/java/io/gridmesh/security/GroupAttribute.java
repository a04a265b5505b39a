package io.gridmesh.security;

import java.nio.charset.StandardCharsets;
import java.security.cert.X509Certificate;
import java.util.Optional;

public final class GroupAttribute {
    public static final String OID = "1.2.42.42";

    private static final int TAG_OCTET_STRING = 0x04;
    private static final int TAG_UTF8_STRING = 0x0C;
    private static final int TAG_PRINTABLE_STRING = 0x13;
    private static final int TAG_IA5_STRING = 0x16;

    private GroupAttribute() {
    }

    public static Optional<String> read(X509Certificate certificate) {
        byte[] raw = certificate.getExtensionValue(OID);
        if (raw == null) {
            return Optional.empty();
        }
        // getExtensionValue wraps the extension body in an OCTET STRING.
        Tlv outer = Tlv.parse(raw, 0);
        if (outer == null || outer.tag != TAG_OCTET_STRING) {
            return Optional.empty();
        }
        Tlv inner = Tlv.parse(raw, outer.valueOffset);
        if (inner == null) {
            return Optional.empty();
        }
        if (inner.tag != TAG_UTF8_STRING && inner.tag != TAG_PRINTABLE_STRING && inner.tag != TAG_IA5_STRING) {
            return Optional.empty();
        }
        String value = new String(raw, inner.valueOffset, inner.length, StandardCharsets.UTF_8).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private record Tlv(int tag, int valueOffset, int length) {
        static Tlv parse(byte[] data, int offset) {
            if (offset + 2 > data.length) {
                return null;
            }
            int tag = data[offset] & 0xFF;
            int first = data[offset + 1] & 0xFF;
            int cursor = offset + 2;
            int length;
            if (first < 0x80) {
                length = first;
            } else {
                int count = first & 0x7F;
                if (count == 0 || count > 3 || cursor + count > data.length) {
                    return null;
                }
                length = 0;
                for (int i = 0; i < count; i++) {
                    length = (length << 8) | (data[cursor++] & 0xFF);
                }
            }
            if (cursor + length > data.length) {
                return null;
            }
            return new Tlv(tag, cursor, length);
        }
    }
}

package io.atprose.types;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;

/**
 * A decentralized identifier: {@code did:<method>:<method-specific-id>}.
 *
 * <p>
 * Generic DID syntax is enforced for every method. The {@code plc} and
 * {@code web} methods additionally get method-specific checks. DIDs are
 * case-sensitive, so the canonical form is the input itself.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class Did {

    /** Default length ceiling (2 KiB). */
    public static final int DEFAULT_MAX_LENGTH = 2048;

    private static final int PLC_ID_LENGTH = 24;

    private final String value;
    private final String method;
    private final String identifier;

    private Did(String value, String method, String identifier) {
        this.value = value;
        this.method = method;
        this.identifier = identifier;
    }

    /**
     * Rules a DID must satisfy beyond its generic syntax.
     *
     * @param maxLength      maximum total length in characters
     * @param allowedMethods registered methods; empty means any syntactically valid method
     */
    public record Policy(int maxLength, Set<String> allowedMethods) {

        /** 2 KiB ceiling, any method. */
        public static final Policy DEFAULT = new Policy(DEFAULT_MAX_LENGTH, Set.of());

        public Policy {
            if (maxLength <= 0) {
                throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
            }
            allowedMethods = Set.copyOf(Objects.requireNonNull(allowedMethods, "allowedMethods must not be null"));
        }
    }

    /** Parses a DID under {@link Policy#DEFAULT}. */
    public static Did parse(String raw) {
        return parse(raw, Policy.DEFAULT);
    }

    /**
     * Parses a DID.
     *
     * @throws InvalidFormatException if the DID is invalid
     */
    public static Did parse(String raw, Policy policy) {
        if (raw == null || !raw.startsWith("did:")) {
            throw new InvalidFormatException(FormatError.DID_MISSING_PREFIX, raw);
        }
        if (raw.length() > policy.maxLength()) {
            throw new InvalidFormatException(FormatError.DID_TOO_LONG, raw);
        }
        int colon = raw.indexOf(':', 4);
        if (colon < 0) {
            throw new InvalidFormatException(FormatError.DID_BAD_METHOD, raw);
        }
        String method = raw.substring(4, colon);
        if (method.isEmpty() || !method.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9'))) {
            throw new InvalidFormatException(FormatError.DID_BAD_METHOD, raw);
        }
        if (!policy.allowedMethods().isEmpty() && !policy.allowedMethods().contains(method)) {
            throw new InvalidFormatException(FormatError.DID_METHOD_NOT_ALLOWED, raw);
        }
        String identifier = raw.substring(colon + 1);
        if (identifier.isEmpty()) {
            throw new InvalidFormatException(FormatError.DID_EMPTY_IDENTIFIER, raw);
        }
        if (identifier.endsWith(":")) {
            throw new InvalidFormatException(FormatError.DID_TRAILING_COLON, raw);
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9')
                    || c == '.'
                    || c == '_'
                    || c == '-'
                    || c == ':'
                    || c == '%';
            if (!allowed) {
                throw new InvalidFormatException(FormatError.DID_INVALID_CHARACTER, raw);
            }
        }
        String decoded = percentDecode(identifier, raw);

        switch (method) {
            case "plc" -> checkPlc(identifier, raw);
            case "web" -> checkWeb(decoded, raw);
            default -> {
                // generic syntax only
            }
        }
        return new Did(raw, method, identifier);
    }

    /** Returns {@code true} if {@code raw} parses under {@link Policy#DEFAULT}. */
    public static boolean isValid(String raw) {
        try {
            parse(raw);
            return true;
        } catch (InvalidFormatException e) {
            return false;
        }
    }

    /** The DID method, e.g. {@code plc}. */
    public String method() {
        return method;
    }

    /** The method-specific identifier as written (still percent-encoded). */
    public String identifier() {
        return identifier;
    }

    /** The method-specific identifier with percent escapes decoded as UTF-8. */
    public String decodedIdentifier() {
        return percentDecode(identifier, value);
    }

    private static void checkPlc(String identifier, String raw) {
        if (identifier.length() != PLC_ID_LENGTH) {
            throw new InvalidFormatException(FormatError.DID_PLC_MALFORMED, raw);
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= '2' && c <= '7'))) {
                throw new InvalidFormatException(FormatError.DID_PLC_MALFORMED, raw);
            }
        }
    }

    private static void checkWeb(String decoded, String raw) {
        String host = decoded;
        int portSeparator = decoded.indexOf(':');
        if (portSeparator >= 0) {
            host = decoded.substring(0, portSeparator);
            String port = decoded.substring(portSeparator + 1);
            if (port.isEmpty() || port.length() > 5 || !port.chars().allMatch(c -> c >= '0' && c <= '9')) {
                throw new InvalidFormatException(FormatError.DID_WEB_MALFORMED, raw);
            }
        }
        try {
            Handle.parse(host, false);
        } catch (InvalidFormatException e) {
            throw new InvalidFormatException(FormatError.DID_WEB_MALFORMED, raw);
        }
    }

    /** RFC 3986 percent decoding; escapes must be {@code %HH} and the result valid UTF-8. */
    private static String percentDecode(String identifier, String raw) {
        if (identifier.indexOf('%') < 0) {
            return identifier;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(identifier.length());
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (c != '%') {
                bytes.write(c);
                continue;
            }
            if (i + 2 >= identifier.length()) {
                throw new InvalidFormatException(FormatError.DID_BAD_PERCENT_ESCAPE, raw);
            }
            int hi = Character.digit(identifier.charAt(i + 1), 16);
            int lo = Character.digit(identifier.charAt(i + 2), 16);
            if (hi < 0 || lo < 0) {
                throw new InvalidFormatException(FormatError.DID_BAD_PERCENT_ESCAPE, raw);
            }
            bytes.write((hi << 4) | lo);
            i += 2;
        }
        try {
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes.toByteArray()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidFormatException(FormatError.DID_BAD_PERCENT_ESCAPE, raw);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Did other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

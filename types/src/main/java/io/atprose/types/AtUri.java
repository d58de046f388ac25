package io.atprose.types;

import java.util.Optional;

/**
 * An {@code at://} URI addressing a repository, a collection or a single record:
 * {@code at://<authority>[/<collection>[/<rkey>]][#<fragment>]}.
 *
 * <p>
 * The authority is a {@link Did} or {@link Handle}, the collection an
 * {@link Nsid} and the record a {@link RecordKey}. Query strings are not
 * accepted. The canonical form re-serializes each part canonically.
 */
public final class AtUri {

    static final int MAX_LENGTH = 8192;

    private final AtIdentifier authority;
    private final Nsid collection;
    private final RecordKey recordKey;
    private final String fragment;

    private AtUri(AtIdentifier authority, Nsid collection, RecordKey recordKey, String fragment) {
        this.authority = authority;
        this.collection = collection;
        this.recordKey = recordKey;
        this.fragment = fragment;
    }

    /** Parses with strict handles and the default DID policy. */
    public static AtUri parse(String raw) {
        return parse(raw, true, Did.Policy.DEFAULT);
    }

    /**
     * Parses an AT-URI.
     *
     * @throws InvalidFormatException if the URI is invalid
     */
    public static AtUri parse(String raw, boolean strictHandles, Did.Policy didPolicy) {
        if (raw == null || !raw.startsWith("at://")) {
            throw new InvalidFormatException(FormatError.AT_URI_BAD_SCHEME, raw);
        }
        if (raw.length() > MAX_LENGTH) {
            throw new InvalidFormatException(FormatError.AT_URI_TOO_LONG, raw);
        }
        String rest = raw.substring("at://".length());
        String fragment = null;
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            fragment = rest.substring(hash + 1);
            rest = rest.substring(0, hash);
            if (!fragment.startsWith("/")) {
                throw new InvalidFormatException(FormatError.AT_URI_MALFORMED, raw);
            }
        }
        if (rest.indexOf('?') >= 0 || rest.endsWith("/")) {
            throw new InvalidFormatException(FormatError.AT_URI_MALFORMED, raw);
        }
        String[] parts = rest.split("/", -1);
        if (parts.length > 3) {
            throw new InvalidFormatException(FormatError.AT_URI_MALFORMED, raw);
        }

        AtIdentifier authority;
        try {
            authority = AtIdentifier.parse(parts[0], strictHandles, didPolicy);
        } catch (InvalidFormatException e) {
            throw new InvalidFormatException(FormatError.AT_URI_BAD_AUTHORITY, raw);
        }
        Nsid collection = null;
        if (parts.length > 1) {
            try {
                collection = Nsid.parse(parts[1]);
            } catch (InvalidFormatException e) {
                throw new InvalidFormatException(FormatError.AT_URI_BAD_COLLECTION, raw);
            }
        }
        RecordKey recordKey = null;
        if (parts.length > 2) {
            try {
                recordKey = RecordKey.parse(parts[2]);
            } catch (InvalidFormatException e) {
                throw new InvalidFormatException(FormatError.AT_URI_BAD_RECORD_KEY, raw);
            }
        }
        return new AtUri(authority, collection, recordKey, fragment);
    }

    public AtIdentifier authority() {
        return authority;
    }

    public Optional<Nsid> collection() {
        return Optional.ofNullable(collection);
    }

    public Optional<RecordKey> recordKey() {
        return Optional.ofNullable(recordKey);
    }

    public Optional<String> fragment() {
        return Optional.ofNullable(fragment);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AtUri other && toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("at://").append(authority);
        if (collection != null) {
            out.append('/').append(collection);
        }
        if (recordKey != null) {
            out.append('/').append(recordKey);
        }
        if (fragment != null) {
            out.append('#').append(fragment);
        }
        return out.toString();
    }
}

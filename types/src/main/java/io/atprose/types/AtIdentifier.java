package io.atprose.types;

import java.util.Optional;

/** Either a {@link Did} or a {@link Handle}, as accepted by the {@code at-identifier} format. */
public final class AtIdentifier {

    private final Did did;
    private final Handle handle;

    private AtIdentifier(Did did, Handle handle) {
        this.did = did;
        this.handle = handle;
    }

    /** Parses with strict handles and the default DID policy. */
    public static AtIdentifier parse(String raw) {
        return parse(raw, true, Did.Policy.DEFAULT);
    }

    /**
     * Parses a DID (input starting with {@code did:}) or otherwise a handle.
     *
     * @throws InvalidFormatException with the DID or handle error that applied
     */
    public static AtIdentifier parse(String raw, boolean strictHandles, Did.Policy didPolicy) {
        if (raw != null && raw.startsWith("did:")) {
            return new AtIdentifier(Did.parse(raw, didPolicy), null);
        }
        return new AtIdentifier(null, Handle.parse(raw, strictHandles));
    }

    public Optional<Did> did() {
        return Optional.ofNullable(did);
    }

    public Optional<Handle> handle() {
        return Optional.ofNullable(handle);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AtIdentifier other && toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return did != null ? did.toString() : handle.toString();
    }
}

package io.atprose.types;

/**
 * The specific rule an identifier string violated. Every {@link InvalidFormatException} carries
 * exactly one of these so callers can surface a precise reason instead of a generic parse failure.
 */
public enum FormatError {
    // did
    DID_MISSING_PREFIX("missing 'did:' prefix"),
    DID_BAD_METHOD("DID method must be lowercase ASCII letters or digits"),
    DID_METHOD_NOT_ALLOWED("DID method is not registered"),
    DID_EMPTY_IDENTIFIER("empty DID method-specific identifier"),
    DID_TRAILING_COLON("DID must not end with ':'"),
    DID_INVALID_CHARACTER("invalid character in DID"),
    DID_BAD_PERCENT_ESCAPE("invalid percent escape in DID"),
    DID_TOO_LONG("DID exceeds maximum length"),
    DID_PLC_MALFORMED("did:plc identifier must be 24 lowercase base32 characters"),
    DID_WEB_MALFORMED("did:web identifier must be a hostname with an optional port"),

    // handle
    HANDLE_EMPTY("empty handle"),
    HANDLE_TOO_LONG("handle exceeds 253 characters"),
    HANDLE_SINGLE_LABEL("handle must contain at least one '.'"),
    HANDLE_RESERVED_TLD("handle top-level domain is reserved"),
    HANDLE_NUMERIC_TLD("handle top-level domain must start with a letter"),
    LABEL_EMPTY("empty handle label"),
    LABEL_TOO_LONG("handle label exceeds 63 characters"),
    LABEL_INVALID_CHARACTER("invalid character in handle label"),
    LABEL_HYPHEN_EDGE("handle label must not start or end with '-'"),

    // nsid
    NSID_TOO_LONG("NSID exceeds 317 characters"),
    NSID_TOO_FEW_SEGMENTS("NSID needs at least three segments"),
    NSID_SEGMENT_EMPTY("empty NSID segment"),
    NSID_SEGMENT_TOO_LONG("NSID segment exceeds 63 characters"),
    NSID_INVALID_DOMAIN_LABEL("invalid NSID domain segment"),
    NSID_INVALID_NAME("NSID name must match [a-zA-Z][a-zA-Z0-9]*"),
    TYPE_ID_MALFORMED("malformed type reference"),

    // record key
    RKEY_EMPTY("empty record key"),
    RKEY_TOO_LONG("record key exceeds 512 bytes"),
    RKEY_RESERVED("record key must not be '.' or '..'"),
    RKEY_INVALID_CHARACTER("invalid character in record key"),

    // tid
    TID_BAD_LENGTH("TID must be exactly 13 characters"),
    TID_INVALID_CHARACTER("invalid character in TID"),
    TID_HIGH_BIT_SET("TID high bit must be zero"),

    // cid
    CID_EMPTY("empty CID"),
    BAD_MULTIBASE_PREFIX("unsupported multibase prefix"),
    INVALID_MULTIBASE_ENCODING("invalid multibase payload"),
    UNSUPPORTED_CID_VERSION("unsupported CID version"),
    CID_TRUNCATED("CID ends before its multihash is complete"),
    DIGEST_LENGTH_MISMATCH("multihash digest length does not match its hash function"),
    CID_TRAILING_BYTES("unexpected bytes after multihash digest"),

    // language
    LANGUAGE_MALFORMED("malformed BCP-47 language tag"),
    LANGUAGE_BAD_PRIMARY_SUBTAG("primary language subtag must be 2-3 letters"),
    LANGUAGE_DUPLICATE_SUBTAG("duplicate variant or extension subtag"),

    // datetime
    DATETIME_MALFORMED("not an RFC 3339 datetime"),
    MISSING_TIMEZONE("datetime must carry 'Z' or a numeric offset"),
    UNKNOWN_LOCAL_OFFSET("'-00:00' offset is not allowed"),
    DATETIME_OUT_OF_RANGE("datetime field out of range"),

    // at-uri
    AT_URI_TOO_LONG("AT-URI exceeds 8192 characters"),
    AT_URI_BAD_SCHEME("AT-URI must start with 'at://'"),
    AT_URI_MALFORMED("malformed AT-URI path"),
    AT_URI_BAD_AUTHORITY("AT-URI authority is neither a DID nor a handle"),
    AT_URI_BAD_COLLECTION("AT-URI collection is not a valid NSID"),
    AT_URI_BAD_RECORD_KEY("AT-URI record key is invalid"),

    // generic
    URI_MALFORMED("not an absolute URI");

    private final String description;

    FormatError(String description) {
        this.description = description;
    }

    /** Human-readable description of the rule. */
    public String description() {
        return description;
    }
}

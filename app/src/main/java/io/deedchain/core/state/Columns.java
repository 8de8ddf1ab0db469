package io.deedchain.core.state;

import io.deedchain.core.model.AccessGrant;
import io.deedchain.core.model.DocumentRecord;
import io.deedchain.core.model.PropertyMetadata;
import io.deedchain.core.model.StatusChange;
import io.deedchain.core.model.TransferRecord;
import io.deedchain.core.model.VerificationRecord;

import java.util.List;

/**
 * Every map the registry keeps.
 *
 * Layout:
 *  - "properties"     : propertyId          -> PropertyMetadata
 *  - "owners"         : propertyId          -> owner
 *  - "membership"     : (owner, propertyId) -> Boolean
 *  - "verifications"  : propertyId          -> VerificationRecord
 *  - "transfers"      : (propertyId, seq)   -> TransferRecord
 *  - "documents"      : (propertyId, seq)   -> DocumentRecord
 *  - "status-history" : (propertyId, seq)   -> StatusChange
 *  - "grants"         : (propertyId, who)   -> AccessGrant
 *  - "counters"       : (scope, propertyId) -> Long
 *  - "meta"           : name                -> Long
 */
public final class Columns {
    private Columns() {}

    public static final Column<Long, PropertyMetadata> PROPERTIES =
            new Column<>("properties", KeyCodec.LONG, PropertyMetadata.class);
    public static final Column<Long, String> OWNERS =
            new Column<>("owners", KeyCodec.LONG, String.class);
    public static final Column<MembershipKey, Boolean> MEMBERSHIP =
            new Column<>("membership", MembershipKey.CODEC, Boolean.class);
    public static final Column<Long, VerificationRecord> VERIFICATIONS =
            new Column<>("verifications", KeyCodec.LONG, VerificationRecord.class);
    public static final Column<SequenceKey, TransferRecord> TRANSFERS =
            new Column<>("transfers", SequenceKey.CODEC, TransferRecord.class);
    public static final Column<SequenceKey, DocumentRecord> DOCUMENTS =
            new Column<>("documents", SequenceKey.CODEC, DocumentRecord.class);
    public static final Column<SequenceKey, StatusChange> STATUS_HISTORY =
            new Column<>("status-history", SequenceKey.CODEC, StatusChange.class);
    public static final Column<GrantKey, AccessGrant> GRANTS =
            new Column<>("grants", GrantKey.CODEC, AccessGrant.class);
    public static final Column<CounterKey, Long> COUNTERS =
            new Column<>("counters", CounterKey.CODEC, Long.class);
    public static final Column<String, Long> META =
            new Column<>("meta", KeyCodec.UTF8, Long.class);

    /** Key in {@link #META} holding the highest height the registry has executed at. */
    public static final String HEIGHT = "height";

    public static final List<Column<?, ?>> ALL = List.of(
            PROPERTIES, OWNERS, MEMBERSHIP, VERIFICATIONS, TRANSFERS,
            DOCUMENTS, STATUS_HISTORY, GRANTS, COUNTERS, META
    );
}
